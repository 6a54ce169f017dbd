package com.e2eq.skos.core;

import com.e2eq.skos.runtime.CleanerOptions;
import com.e2eq.skos.validation.Finding;
import com.e2eq.skos.validation.RuleOutcome;

import java.util.*;

/**
 * State owned by one cleaning run: counters, the change log, findings and the
 * document header. A new instance is created for every document, so nothing
 * leaks between runs. Only the pipeline classes of this package update it; callers
 * outside the package see read-only views.
 */
public final class CleaningRun {

    private final CleanerOptions options;
    private final EnumMap<Statistic, Integer> statistics = new EnumMap<>(Statistic.class);
    private final List<String> changeLog = new ArrayList<>();
    private final List<Finding> violations = new ArrayList<>();
    private final List<Finding> warnings = new ArrayList<>();
    private final List<Finding> infos = new ArrayList<>();
    // URIs kept so far; shared across chunks
    private final Set<String> seenUris = new HashSet<>();
    private DocumentHeader header = DocumentHeader.empty();

    public CleaningRun(CleanerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        for (Statistic s : Statistic.values()) {
            statistics.put(s, 0);
        }
    }

    public CleanerOptions options() {
        return options;
    }

    public DocumentHeader header() {
        return header;
    }

    void header(DocumentHeader header) {
        this.header = header == null ? DocumentHeader.empty() : header;
    }

    void increment(Statistic statistic) {
        add(statistic, 1);
    }

    void add(Statistic statistic, int delta) {
        statistics.merge(statistic, delta, Integer::sum);
    }

    void set(Statistic statistic, int value) {
        statistics.put(statistic, value);
    }

    public int count(Statistic statistic) {
        return statistics.getOrDefault(statistic, 0);
    }

    public Map<Statistic, Integer> statistics() {
        return Collections.unmodifiableMap(statistics);
    }

    void logChange(String entry) {
        changeLog.add(entry);
    }

    public List<String> changeLog() {
        return Collections.unmodifiableList(changeLog);
    }

    /**
     * Registers a URI as kept. Returns false when it was already kept earlier in the run.
     */
    boolean markSeen(String uri) {
        return seenUris.add(uri);
    }

    void record(RuleOutcome outcome) {
        violations.addAll(outcome.violations());
        warnings.addAll(outcome.warnings());
        infos.addAll(outcome.infos());
    }

    public List<Finding> violations() {
        return Collections.unmodifiableList(violations);
    }

    public List<Finding> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<Finding> infos() {
        return Collections.unmodifiableList(infos);
    }
}
