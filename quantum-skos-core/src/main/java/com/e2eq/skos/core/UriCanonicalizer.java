package com.e2eq.skos.core;

import com.e2eq.skos.runtime.CleanerOptions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves identifier tokens ({@code <abs>}, {@code <relative>}, {@code prefix:local},
 * bare tokens) to absolute URIs and classifies each change as a fix or a normalization.
 * <p>
 * Resolution order: strip brackets; keep absolute URIs; resolve against the base URI
 * when one is declared and the token has no colon; expand prefixed names through the
 * prefix table; otherwise prepend the default ESCO skill namespace.
 * </p>
 */
public final class UriCanonicalizer {

    public static final String ESCO_PREFIX = "esco";
    public static final String ESCO_SKILL_NAMESPACE = "http://data.europa.eu/esco/skill/";
    public static final String FALLBACK_NAMESPACE = "http://example.org/";

    private static final Pattern ABSOLUTE = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://.*");

    private final String baseUri;
    private final Map<String, String> prefixNamespaces = new LinkedHashMap<>();

    public UriCanonicalizer(@Nullable String baseUri, @Nullable Map<String, String> extraPrefixes) {
        this.baseUri = baseUri == null || baseUri.isBlank() ? null : baseUri;
        prefixNamespaces.put(ESCO_PREFIX, ESCO_SKILL_NAMESPACE);
        if (extraPrefixes != null) {
            prefixNamespaces.putAll(extraPrefixes);
        }
    }

    public static UriCanonicalizer forRun(DocumentHeader header, CleanerOptions options) {
        return new UriCanonicalizer(header.baseUri().orElse(null), options.getPrefixNamespaces());
    }

    @Nullable
    public String baseUri() {
        return baseUri;
    }

    public static boolean isAbsolute(String value) {
        return ABSOLUTE.matcher(value).matches();
    }

    public static String stripBrackets(String token) {
        String t = token.trim();
        if (t.startsWith("<") && t.endsWith(">")) {
            return t.substring(1, t.length() - 1);
        }
        return t;
    }

    public String canonicalize(@NotNull String raw) {
        String uri = stripBrackets(raw);
        if (isAbsolute(uri)) {
            return uri;
        }
        if (baseUri != null && !uri.contains(":")) {
            return resolveAgainstBase(uri);
        }
        int colon = uri.indexOf(':');
        if (colon >= 0) {
            String prefix = uri.substring(0, colon);
            String local = uri.substring(colon + 1);
            String ns = prefixNamespaces.get(prefix);
            if (ns != null) {
                return ns + local;
            }
            return FALLBACK_NAMESPACE + prefix + "/" + local;
        }
        return ESCO_SKILL_NAMESPACE + uri;
    }

    /**
     * Decides whether turning {@code rawUri} into {@code cleanedUri} repaired a defect.
     * A relative token that base resolution maps onto the cleaned URI is reported as
     * {@link UriChange.Kind#NONE}: the serializer writes it back as the same relative
     * token. This is a permissive policy and does not detect cross-base discrepancies.
     */
    public UriChange classify(@NotNull String rawUri, @NotNull String cleanedUri) {
        String raw = rawUri.trim();
        boolean bracketed = raw.startsWith("<") && raw.endsWith(">");
        String inner = bracketed ? raw.substring(1, raw.length() - 1) : raw;

        if (bracketed && isAbsolute(inner)) {
            return UriChange.normalization("URI normalized (angle brackets removed): " + raw);
        }
        if (baseUri != null && !isAbsolute(inner) && !inner.contains(":")) {
            String expected = resolveAgainstBase(inner);
            if (expected.equals(cleanedUri)) {
                return UriChange.none();
            }
            return UriChange.normalization("URI normalized using @base: " + raw + " -> <" + cleanedUri + ">");
        }
        if (inner.contains(":") && !isAbsolute(inner)) {
            return UriChange.fix("URI fixed: expanded prefix '" + inner + "' -> <" + cleanedUri + ">");
        }
        if (!isAbsolute(inner) && baseUri == null) {
            return UriChange.fix("URI fixed: added default namespace -> <" + cleanedUri + "> from '" + raw + "'");
        }
        if (!raw.equals(rawUri)) {
            return UriChange.normalization("URI normalized (whitespace trimmed): '" + rawUri + "' -> '" + raw + "'");
        }
        if (!raw.equals(cleanedUri)) {
            return UriChange.normalization("URI normalized: " + raw + " -> <" + cleanedUri + ">");
        }
        return UriChange.none();
    }

    /**
     * The token the serializer writes for an absolute URI: relative to the base URI when
     * the URI lives under it, bracketed absolute otherwise.
     */
    public String toToken(String uri) {
        if (baseUri != null) {
            String prefix = baseUri.endsWith("/") ? baseUri : baseUri + "/";
            if (uri.startsWith(prefix)) {
                String relative = uri.substring(prefix.length());
                // a colon would be read back as a prefixed name
                if (!relative.isEmpty() && !relative.contains(":")) return "<" + relative + ">";
            }
        }
        return "<" + uri + ">";
    }

    private String resolveAgainstBase(String relative) {
        String base = baseUri.endsWith("/") ? baseUri.substring(0, baseUri.length() - 1) : baseUri;
        return base + "/" + relative;
    }
}
