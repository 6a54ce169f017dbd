package com.e2eq.skos.core;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Code-token conventions used to infer the implied hierarchy of a vocabulary whose
 * local identifiers end with digit groups, e.g. {@code .../42-10} or {@code .../311}.
 */
public final class HierarchyCodes {
    private HierarchyCodes() {}

    private static final Pattern TRAILING_CODE = Pattern.compile("(\\d+(?:-\\d+)*)$");

    /**
     * The trailing code of the last path segment of a URI or identifier token.
     */
    public static Optional<String> extractCode(String uriOrToken) {
        if (uriOrToken == null || uriOrToken.isBlank()) return Optional.empty();
        String s = UriCanonicalizer.stripBrackets(uriOrToken);
        if (s.contains("/")) {
            while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
            s = s.substring(s.lastIndexOf('/') + 1);
        }
        Matcher m = TRAILING_CODE.matcher(s);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Valid parent codes of {@code code}, longest first, without duplicates and without
     * the code itself. {@code 44-1-2 -> [44-1, 44, 4]}, {@code 311 -> [31, 3]}.
     */
    public static List<String> parentCandidates(String code) {
        if (code == null || code.isEmpty()) return List.of();
        Set<String> candidates = new LinkedHashSet<>();
        if (code.contains("-")) {
            String[] parts = code.split("-");
            for (int i = parts.length - 1; i > 0; i--) {
                candidates.add(String.join("-", Arrays.asList(parts).subList(0, i)));
            }
            addDigitPrefixes(parts[0], candidates);
        } else {
            addDigitPrefixes(code, candidates);
        }
        candidates.remove(code);
        return List.copyOf(candidates);
    }

    private static void addDigitPrefixes(String digits, Set<String> into) {
        if (digits.length() < 2 || !digits.chars().allMatch(Character::isDigit)) return;
        for (int k = digits.length() - 1; k > 0; k--) {
            into.add(digits.substring(0, k));
        }
    }
}
