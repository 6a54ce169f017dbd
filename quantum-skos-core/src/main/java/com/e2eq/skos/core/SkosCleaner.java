package com.e2eq.skos.core;

import com.e2eq.skos.runtime.CleanerOptions;
import com.e2eq.skos.validation.FindingSummary;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;
import com.e2eq.skos.validation.ValidationEngine;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Cleans a SKOS thesaurus document.
 * <p>
 * The run extracts the header, segments the text into concept blocks, parses and
 * repairs each block, drops duplicate concepts, optionally adds missing
 * {@code skos:broader} links, validates the result and serializes it. Parsing
 * defects are repaired and counted; a failure in the autofix or in a validation rule
 * aborts the run and no document is produced.
 * </p>
 */
public final class SkosCleaner {

    private static final Logger LOG = Logger.getLogger(SkosCleaner.class);

    public static final String PHASE_AUTOFIX = "autofix";

    private final CleanerOptions options;
    private final ValidationEngine validationEngine;
    private final ConceptBlockSegmenter segmenter = new ConceptBlockSegmenter();
    private final ConceptDeduplicator deduplicator = new ConceptDeduplicator();
    private final HierarchyAutofixer autofixer = new HierarchyAutofixer();

    public SkosCleaner(@NotNull CleanerOptions options) {
        this(options, new ValidationEngine());
    }

    public SkosCleaner(@NotNull CleanerOptions options, @NotNull ValidationEngine validationEngine) {
        options.validate();
        this.options = options;
        this.validationEngine = validationEngine;
    }

    public CleanerOptions options() {
        return options;
    }

    public PhaseResult<CleaningResult> clean(@NotNull String content) {
        CleaningRun run = new CleaningRun(options);
        DocumentHeader header = DocumentHeaderExtractor.extract(content);
        run.header(header);
        UriCanonicalizer canonicalizer = UriCanonicalizer.forRun(header, options);
        TextNormalizer normalizer = new TextNormalizer(run);
        ConceptParser parser = new ConceptParser(run, canonicalizer, normalizer);

        List<String> blocks = segmenter.segment(content, run);
        LOG.debugf("Segmented %d concept blocks", blocks.size());
        List<Concept> parsed = new ArrayList<>();
        for (String block : blocks) {
            parser.parse(block).ifPresent(parsed::add);
        }

        List<Concept> concepts = deduplicate(parsed, run);

        if (options.isAutofixBroader()) {
            try {
                int added = autofixer.apply(concepts, run);
                LOG.debugf("Hierarchy autofix added %d broader links", added);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Hierarchy autofix failed");
                return PhaseResult.failure(PHASE_AUTOFIX, e);
            }
        }

        if (options.isValidationEnabled()) {
            ValidationContext context = new ValidationContext(header, canonicalizer, options);
            PhaseResult<RuleOutcome> validation = validationEngine.validate(concepts, context);
            if (validation instanceof PhaseResult.Failure<RuleOutcome> failure) {
                return new PhaseResult.Failure<>(failure.phase(), failure.message(), failure.cause());
            }
            run.record(validation.orElseThrow());
        }

        String document = new TurtleSerializer(canonicalizer, normalizer, run).serialize(concepts, header);
        run.set(Statistic.FINAL_CONCEPTS, concepts.size());
        concepts.forEach(Concept::freeze);

        var summary = FindingSummary.summarize(run.violations(), run.warnings(), run.infos());
        LOG.infof("Cleaned %d of %d concepts: %d duplicates removed, %d URIs fixed, %d violations, %d warnings, %d infos",
                concepts.size(), run.count(Statistic.TOTAL_CONCEPTS), run.count(Statistic.DUPLICATES_REMOVED),
                run.count(Statistic.MALFORMED_URIS_FIXED), run.violations().size(), run.warnings().size(),
                run.infos().size());
        return PhaseResult.success(new CleaningResult(List.copyOf(concepts), document, summary, run));
    }

    /**
     * @throws com.e2eq.skos.exceptions.CleaningException when a phase fails
     */
    public CleaningResult cleanOrThrow(@NotNull String content) {
        return clean(content).orElseThrow();
    }

    private List<Concept> deduplicate(List<Concept> parsed, CleaningRun run) {
        if (!options.chunkedFor(parsed.size())) {
            return deduplicator.deduplicate(parsed, run);
        }
        int chunkSize = options.getChunkSize();
        List<Concept> kept = new ArrayList<>();
        for (int start = 0; start < parsed.size(); start += chunkSize) {
            List<Concept> chunk = parsed.subList(start, Math.min(start + chunkSize, parsed.size()));
            kept.addAll(deduplicator.deduplicate(chunk, run));
            run.increment(Statistic.CHUNKS_PROCESSED);
        }
        LOG.debugf("Processed %d concepts in %d chunks", parsed.size(), run.count(Statistic.CHUNKS_PROCESSED));
        return kept;
    }
}
