package com.e2eq.skos.validation.rules;

import com.e2eq.skos.core.Concept;
import com.e2eq.skos.core.LangString;
import com.e2eq.skos.spi.ValidationRule;
import com.e2eq.skos.validation.Finding;
import com.e2eq.skos.validation.FindingCategory;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks that concept URIs carry a scheme and an authority and that label language tags are well formed.
 */
public final class UriAndLanguageTagRule implements ValidationRule {

    private static final Pattern LANGUAGE_TAG = Pattern.compile("^[a-z]{2,3}(-[A-Za-z0-9]{1,8})*$");

    @Override
    public String name() {
        return "uris-and-language-tags";
    }

    @Override
    public RuleOutcome validate(List<Concept> concepts, ValidationContext context) {
        List<Finding> findings = new ArrayList<>();
        for (Concept concept : concepts) {
            if (!isValidUri(concept.uri())) {
                findings.add(Finding.violation(FindingCategory.URI_FORMAT_INVALID,
                        "Invalid URI format: " + concept.uri()));
            }
            List<LangString> labels = new ArrayList<>(concept.prefLabels());
            labels.addAll(concept.altLabels());
            for (LangString label : labels) {
                String tag = label.language();
                if (tag != null && !tag.isEmpty() && !isValidLanguageTag(tag)) {
                    findings.add(Finding.warning(FindingCategory.LANGUAGE_TAG_INVALID,
                            "Potentially invalid language tag '" + tag + "' in " + concept.uri()));
                }
            }
        }
        return RuleOutcome.of(findings);
    }

    /**
     * A URI is accepted when it parses and has both a scheme and an authority.
     */
    static boolean isValidUri(String uri) {
        try {
            URI parsed = new URI(uri);
            return parsed.getScheme() != null && parsed.getRawAuthority() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    static boolean isValidLanguageTag(String tag) {
        return LANGUAGE_TAG.matcher(tag).matches();
    }
}
