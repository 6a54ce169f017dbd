package com.e2eq.skos.core;

import com.e2eq.skos.validation.Finding;
import com.e2eq.skos.validation.FindingCategory;

import java.util.List;
import java.util.Map;

/**
 * Everything a completed run produced: the cleaned concepts and document, the
 * findings and the per-category summary, plus the run's counters and change log.
 */
public record CleaningResult(List<Concept> concepts,
                             String cleanedDocument,
                             Map<FindingCategory, Integer> summary,
                             CleaningRun run) {

    public List<Finding> violations() {
        return run.violations();
    }

    public List<Finding> warnings() {
        return run.warnings();
    }

    public List<Finding> infos() {
        return run.infos();
    }

    public Map<Statistic, Integer> statistics() {
        return run.statistics();
    }

    public List<String> changeLog() {
        return run.changeLog();
    }

    public int count(Statistic statistic) {
        return run.count(statistic);
    }
}
