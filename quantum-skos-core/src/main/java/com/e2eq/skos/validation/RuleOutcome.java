package com.e2eq.skos.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Findings produced by one rule invocation, split by severity.
 */
public record RuleOutcome(List<Finding> violations, List<Finding> warnings, List<Finding> infos) {

    public static RuleOutcome empty() {
        return new RuleOutcome(List.of(), List.of(), List.of());
    }

    public static RuleOutcome of(Collection<Finding> findings) {
        List<Finding> violations = new ArrayList<>();
        List<Finding> warnings = new ArrayList<>();
        List<Finding> infos = new ArrayList<>();
        for (Finding f : findings) {
            switch (f.severity()) {
                case VIOLATION: violations.add(f); break;
                case WARNING: warnings.add(f); break;
                default: infos.add(f); break;
            }
        }
        return new RuleOutcome(List.copyOf(violations), List.copyOf(warnings), List.copyOf(infos));
    }

    public RuleOutcome plus(RuleOutcome other) {
        List<Finding> violations = new ArrayList<>(this.violations);
        violations.addAll(other.violations);
        List<Finding> warnings = new ArrayList<>(this.warnings);
        warnings.addAll(other.warnings);
        List<Finding> infos = new ArrayList<>(this.infos);
        infos.addAll(other.infos);
        return new RuleOutcome(List.copyOf(violations), List.copyOf(warnings), List.copyOf(infos));
    }

    public int size() {
        return violations.size() + warnings.size() + infos.size();
    }
}
