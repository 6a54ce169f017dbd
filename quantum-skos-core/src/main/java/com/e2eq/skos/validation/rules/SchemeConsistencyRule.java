package com.e2eq.skos.validation.rules;

import com.e2eq.skos.core.Concept;
import com.e2eq.skos.core.ConceptBlockSegmenter;
import com.e2eq.skos.core.Statement;
import com.e2eq.skos.core.StatementTokenizer;
import com.e2eq.skos.core.UriCanonicalizer;
import com.e2eq.skos.spi.ValidationRule;
import com.e2eq.skos.validation.Finding;
import com.e2eq.skos.validation.FindingCategory;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Concept scheme membership: topConceptOf implies inScheme of the same scheme, and
 * every hasTopConcept target of the scheme block is a concept that is inScheme of it.
 * Scheme references are compared in canonical form, so raw and expanded spellings
 * of the same scheme match.
 */
public final class SchemeConsistencyRule implements ValidationRule {

    static final String IN_SCHEME = "skos:inScheme";
    static final String TOP_CONCEPT_OF = "skos:topConceptOf";
    static final String HAS_TOP_CONCEPT = "skos:hasTopConcept";

    private static final Pattern SCHEME_SUBJECT = Pattern.compile(
            "^" + ConceptBlockSegmenter.IDENTIFIER + "\\s+a\\s+skos:ConceptScheme");

    @Override
    public String name() {
        return "scheme-consistency";
    }

    @Override
    public Scope scope() {
        return Scope.GLOBAL;
    }

    @Override
    public RuleOutcome validate(List<Concept> concepts, ValidationContext context) {
        UriCanonicalizer canonicalizer = context.canonicalizer();
        Map<String, Set<String>> inScheme = new HashMap<>();
        List<Finding> findings = new ArrayList<>();

        for (Concept c : concepts) {
            inScheme.put(c.uri(), targets(c, IN_SCHEME, canonicalizer));
        }
        for (Concept c : concepts) {
            Set<String> memberOf = inScheme.get(c.uri());
            for (String prop : c.otherProperties()) {
                Statement st = Statement.parse(prop);
                if (!st.hasPredicate(TOP_CONCEPT_OF)) continue;
                for (String scheme : st.identifiers()) {
                    if (!memberOf.contains(canonicalizer.canonicalize(scheme))) {
                        findings.add(Finding.violation(FindingCategory.SCHEME_TOP_CONCEPT_WITHOUT_IN_SCHEME,
                                "Concept <" + c.uri() + "> has topConceptOf " + scheme
                                        + " but is missing inScheme " + scheme));
                    }
                }
            }
        }

        Optional<String> schemeBlock = context.header().conceptScheme();
        if (schemeBlock.isEmpty()) return RuleOutcome.of(findings);

        List<String> statements = StatementTokenizer.split(schemeBlock.get());
        if (statements.isEmpty()) return RuleOutcome.of(findings);
        Matcher m = SCHEME_SUBJECT.matcher(statements.get(0));
        String subject = m.find() ? m.group(1) : null;
        String subjectToken = subject == null ? null : "<" + UriCanonicalizer.stripBrackets(subject) + ">";
        String canonicalSubject = subject == null ? null : canonicalizer.canonicalize(subject);

        for (String text : statements.subList(1, statements.size())) {
            Statement st = Statement.parse(text);
            if (!st.hasPredicate(HAS_TOP_CONCEPT)) continue;
            for (String target : st.identifiers()) {
                String uri = canonicalizer.canonicalize(target);
                Set<String> memberOf = inScheme.get(uri);
                if (memberOf == null) {
                    findings.add(Finding.violation(FindingCategory.SCHEME_TOP_CONCEPT_NOT_A_CONCEPT,
                            "hasTopConcept points to non-Concept: <" + uri + ">"));
                } else if (canonicalSubject != null && !memberOf.contains(canonicalSubject)) {
                    findings.add(Finding.violation(FindingCategory.SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME,
                            "Concept <" + uri + "> is hasTopConcept of " + subjectToken
                                    + " but missing inScheme " + subjectToken));
                }
            }
        }
        return RuleOutcome.of(findings);
    }

    private static Set<String> targets(Concept concept, String predicate, UriCanonicalizer canonicalizer) {
        Set<String> result = new HashSet<>();
        for (String prop : concept.otherProperties()) {
            Statement st = Statement.parse(prop);
            if (!st.hasPredicate(predicate)) continue;
            for (String id : st.identifiers()) {
                result.add(canonicalizer.canonicalize(id));
            }
        }
        return result;
    }
}
