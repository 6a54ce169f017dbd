package com.e2eq.skos.validation;

import com.e2eq.skos.core.Concept;
import com.e2eq.skos.core.PhaseResult;
import com.e2eq.skos.spi.ValidationRule;
import com.e2eq.skos.validation.rules.*;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the validation rules over the cleaned concepts.
 * <p>
 * In chunked mode rules with {@link ValidationRule.Scope#PER_CHUNK} scope run once
 * per contiguous chunk and global rules once over the full list. Any runtime failure
 * inside a rule aborts validation with a {@link PhaseResult.Failure} naming the rule.
 * </p>
 */
public final class ValidationEngine {

    private static final Logger LOG = Logger.getLogger(ValidationEngine.class);
    public static final String PHASE_PREFIX = "validation:";

    private final List<ValidationRule> rules;

    public ValidationEngine() {
        this(defaultRules());
    }

    public ValidationEngine(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<ValidationRule> defaultRules() {
        return List.of(
                new LabelIntegrityRule(),
                new SemanticRelationRule(),
                new UriAndLanguageTagRule(),
                new SkosXlLabelRule(),
                new HierarchyConsistencyRule(),
                new SchemeConsistencyRule());
    }

    public List<ValidationRule> rules() {
        return rules;
    }

    public PhaseResult<RuleOutcome> validate(List<Concept> concepts, ValidationContext context) {
        List<ValidationRule> active = new ArrayList<>();
        for (ValidationRule rule : rules) {
            if (rule.isEnabled(context.options())) active.add(rule);
        }

        int chunkSize = context.options().getChunkSize();
        boolean chunked = context.options().chunkedFor(concepts.size());
        RuleOutcome outcome = RuleOutcome.empty();

        if (chunked) {
            int chunks = (concepts.size() + chunkSize - 1) / chunkSize;
            LOG.debugf("Validating %d concepts in %d chunks", concepts.size(), chunks);
            for (int start = 0; start < concepts.size(); start += chunkSize) {
                List<Concept> chunk = concepts.subList(start, Math.min(start + chunkSize, concepts.size()));
                for (ValidationRule rule : active) {
                    if (rule.scope() != ValidationRule.Scope.PER_CHUNK) continue;
                    PhaseResult<RuleOutcome> result = run(rule, chunk, context);
                    if (result.isFailure()) return result;
                    outcome = outcome.plus(result.orElseThrow());
                }
            }
            for (ValidationRule rule : active) {
                if (rule.scope() != ValidationRule.Scope.GLOBAL) continue;
                PhaseResult<RuleOutcome> result = run(rule, concepts, context);
                if (result.isFailure()) return result;
                outcome = outcome.plus(result.orElseThrow());
            }
        } else {
            for (ValidationRule rule : active) {
                PhaseResult<RuleOutcome> result = run(rule, concepts, context);
                if (result.isFailure()) return result;
                outcome = outcome.plus(result.orElseThrow());
            }
        }
        return PhaseResult.success(outcome);
    }

    private static PhaseResult<RuleOutcome> run(ValidationRule rule, List<Concept> concepts, ValidationContext context) {
        try {
            RuleOutcome outcome = rule.validate(concepts, context);
            LOG.debugf("Rule %s: %d violations, %d warnings, %d infos",
                    rule.name(), outcome.violations().size(), outcome.warnings().size(), outcome.infos().size());
            return PhaseResult.success(outcome);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Validation rule %s failed", rule.name());
            return PhaseResult.failure(PHASE_PREFIX + rule.name(), e);
        }
    }
}
