package com.e2eq.skos.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;

/**
 * Loads {@link CleanerOptions} from a YAML file or classpath resource.
 * Keys mirror the option names, e.g.
 * <pre>
 * chunkSize: 2000
 * memoryEfficient: true
 * autofixBroader: true
 * prefixNamespaces:
 *   isco: http://data.europa.eu/esco/isco/
 * </pre>
 */
public final class CleanerOptionsLoader {

    public static final String DEFAULT_RESOURCE = "/skos-cleaner.yaml";

    private static final Logger LOG = Logger.getLogger(CleanerOptionsLoader.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public CleanerOptions loadDefault() throws IOException {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public CleanerOptions loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            LOG.debugf("Loading cleaner options from classpath resource %s", resourcePath);
            return load(in);
        }
    }

    public CleanerOptions loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            LOG.debugf("Loading cleaner options from %s", path);
            return load(in);
        }
    }

    public CleanerOptions load(InputStream in) throws IOException {
        CleanerOptions options = mapper.readValue(in, CleanerOptions.class);
        if (options == null) {
            options = CleanerOptions.defaults();
        }
        if (options.getPrefixNamespaces() == null) {
            options.setPrefixNamespaces(new LinkedHashMap<>());
        }
        options.validate();
        return options;
    }
}
