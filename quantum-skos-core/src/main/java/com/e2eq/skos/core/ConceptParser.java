package com.e2eq.skos.core;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one concept block into a {@link Concept}.
 * <p>
 * The block is split into statements. The first must declare the subject as a
 * {@code skos:Concept}; literal-valued SKOS predicates are parsed into
 * {@link LangString} values, everything else is kept as an opaque statement.
 * A block without a subject declaration or without any prefLabel yields no concept.
 * Statements after the terminating {@code .} of the description are dropped and counted.
 * </p>
 */
public final class ConceptParser {

    private static final Pattern SUBJECT = Pattern.compile(
            "^" + ConceptBlockSegmenter.IDENTIFIER + "\\s+a\\s+skos:Concept(?![A-Za-z0-9_])");

    private final CleaningRun run;
    private final UriCanonicalizer canonicalizer;
    private final TextNormalizer normalizer;
    private final String defaultLanguage;

    public ConceptParser(CleaningRun run, UriCanonicalizer canonicalizer, TextNormalizer normalizer) {
        this.run = run;
        this.canonicalizer = canonicalizer;
        this.normalizer = normalizer;
        this.defaultLanguage = run.options().getDefaultLanguage();
    }

    public Optional<Concept> parse(String block) {
        StatementTokenizer.Terminated terminated = StatementTokenizer.splitFirst(block);
        List<String> statements = terminated.statements();
        if (statements.isEmpty()) {
            run.increment(Statistic.BLOCKS_WITHOUT_SUBJECT);
            return Optional.empty();
        }
        Matcher m = SUBJECT.matcher(statements.get(0));
        if (!m.find()) {
            run.increment(Statistic.BLOCKS_WITHOUT_SUBJECT);
            return Optional.empty();
        }

        String rawUri = m.group(1).trim();
        String uri = canonicalizer.canonicalize(rawUri);
        Concept concept = new Concept(uri);
        if (!rawUri.equals(uri)) {
            UriChange change = canonicalizer.classify(rawUri, uri);
            if (change.isLogged()) {
                concept.addIssue(change.isFix() ? "URI fixed" : "URI normalized");
                run.logChange(change.message());
                run.increment(change.isFix() ? Statistic.MALFORMED_URIS_FIXED : Statistic.URI_NORMALIZATIONS);
            }
        }

        // the concept's description ends at its terminator; anything after it has another subject
        for (String stray : StatementTokenizer.split(terminated.remainder())) {
            run.increment(Statistic.STRAY_STATEMENTS_DROPPED);
            run.logChange("Statement after end of <" + uri + "> dropped: " + stray);
        }

        for (String text : statements.subList(1, statements.size())) {
            Statement statement = Statement.parse(text);
            Optional<TextProperty> property = TextProperty.forPredicate(statement.predicate());
            if (property.isPresent()) {
                addLiterals(concept, property.get(), statement);
            } else if (!statement.objects().isEmpty()) {
                concept.addOtherProperty(statement.text());
            }
        }

        if (!concept.hasPrefLabel()) {
            concept.addIssue("No prefLabel found");
            run.increment(Statistic.CONCEPTS_WITHOUT_PREFLABEL);
            return Optional.empty();
        }
        return Optional.of(concept);
    }

    private void addLiterals(Concept concept, TextProperty property, Statement statement) {
        for (Statement.Literal literal : statement.literals()) {
            run.increment(property.isLabel() ? Statistic.LABELS_SEEN : Statistic.TEXT_VALUES_SEEN);
            Optional<String> cleaned = property.isLabel()
                    ? normalizer.cleanLabel(literal.text())
                    : normalizer.cleanText(literal.text());
            String language = literal.language() == null || literal.language().isEmpty()
                    ? defaultLanguage
                    : literal.language();
            cleaned.ifPresent(text -> concept.addValue(property, new LangString(text, language)));
        }
    }
}
