package com.e2eq.skos.validation.rules;

import com.e2eq.skos.core.Concept;
import com.e2eq.skos.core.DocumentHeader;
import com.e2eq.skos.core.LangString;
import com.e2eq.skos.core.TextProperty;
import com.e2eq.skos.core.UriCanonicalizer;
import com.e2eq.skos.runtime.CleanerOptions;
import com.e2eq.skos.validation.ValidationContext;

import java.util.List;
import java.util.Optional;

final class RuleFixtures {
    private RuleFixtures() {}

    static final String BASE = "http://ex.org/";

    static Concept concept(String uri, String... statements) {
        Concept c = new Concept(uri);
        c.addValue(TextProperty.PREF_LABEL, new LangString("Label of " + uri, "en"));
        for (String s : statements) c.addOtherProperty(s);
        return c;
    }

    static ValidationContext context() {
        return context(CleanerOptions.defaults(), null);
    }

    static ValidationContext context(CleanerOptions options, String schemeBlock) {
        DocumentHeader header = new DocumentHeader(Optional.of("@base <" + BASE + "> ."), Optional.of(BASE),
                List.of(), Optional.ofNullable(schemeBlock));
        return new ValidationContext(header, new UriCanonicalizer(BASE, null), options);
    }
}
