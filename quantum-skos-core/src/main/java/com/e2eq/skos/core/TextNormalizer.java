package com.e2eq.skos.core;

import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Repairs literal text: mis-decoded UTF-8 sequences, HTML entities, spacing after
 * punctuation and runs of whitespace. Every effective change is counted on the run
 * and written to its change log.
 */
public final class TextNormalizer {

    static final int LOG_TEXT_LIMIT = 120;

    private static final Map<String, String> MOJIBAKE = new LinkedHashMap<>();
    private static final Map<String, String> HTML_ENTITIES = new LinkedHashMap<>();

    static {
        MOJIBAKE.put("Ã¤", "ä");
        MOJIBAKE.put("Ã¶", "ö");
        MOJIBAKE.put("Ã¼", "ü");
        MOJIBAKE.put("Ã„", "Ä");
        MOJIBAKE.put("Ã–", "Ö");
        MOJIBAKE.put("Ãœ", "Ü");
        MOJIBAKE.put("ÃŸ", "ß");
        MOJIBAKE.put("Ã©", "é");
        MOJIBAKE.put("Ã¨", "è");
        MOJIBAKE.put("Ã¡", "á");
        MOJIBAKE.put("Ã\u00A0", "à");
        MOJIBAKE.put("Ã³", "ó");
        MOJIBAKE.put("Ã²", "ò");
        MOJIBAKE.put("Ãº", "ú");
        MOJIBAKE.put("Ã¹", "ù");

        HTML_ENTITIES.put("&nbsp;", " ");
        HTML_ENTITIES.put("&amp;", "&");
        HTML_ENTITIES.put("&lt;", "<");
        HTML_ENTITIES.put("&gt;", ">");
        HTML_ENTITIES.put("&quot;", "\"");
        HTML_ENTITIES.put("&#39;", "'");
        HTML_ENTITIES.put("&apos;", "'");
    }

    private static final Pattern COMMA = Pattern.compile(",(?!\\s)");
    private static final Pattern PERIOD = Pattern.compile("\\.(?!\\s|$|\\d)");
    private static final Pattern SEMICOLON = Pattern.compile(";(?!\\s)");
    private static final Pattern COLON = Pattern.compile(":(?!\\s|$)");
    private static final Pattern EXCLAMATION = Pattern.compile("!(?!\\s|$)");
    private static final Pattern QUESTION = Pattern.compile("\\?(?!\\s|$)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final CleaningRun run;

    public TextNormalizer(CleaningRun run) {
        this.run = run;
    }

    /**
     * Label variant: encoding repair and whitespace collapse only.
     *
     * @return the cleaned label, or empty when nothing is left
     */
    public Optional<String> cleanLabel(String label) {
        if (label == null || label.isEmpty()) return Optional.empty();

        String fixed = replaceAll(label, MOJIBAKE);
        boolean encodingFixed = !fixed.equals(label);
        if (encodingFixed) {
            run.increment(Statistic.ENCODING_ISSUES_FIXED);
            run.logChange("Label cleaned: '" + abbreviate(label) + "' -> '" + abbreviate(fixed) + "'");
        }

        String collapsed = collapseWhitespace(fixed);
        if (!collapsed.equals(fixed) && !encodingFixed) {
            run.logChange("Label normalized (whitespace): '" + abbreviate(fixed) + "' -> '" + abbreviate(collapsed) + "'");
        }

        if (collapsed.isEmpty()) {
            run.increment(Statistic.EMPTY_VALUES_REMOVED);
            return Optional.empty();
        }
        return Optional.of(collapsed);
    }

    /**
     * Text variant used for definitions, notes and examples: encoding and entity repair,
     * punctuation spacing, whitespace collapse.
     *
     * @return the cleaned text, or empty when nothing is left
     */
    public Optional<String> cleanText(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();

        String decoded = replaceAll(replaceAll(text, MOJIBAKE), HTML_ENTITIES);
        if (!decoded.equals(text)) {
            run.increment(Statistic.ENCODING_ISSUES_FIXED);
        }
        String cleaned = collapseWhitespace(spacePunctuation(decoded));

        if (!cleaned.equals(text)) {
            run.increment(Statistic.TEXT_FIELDS_CLEANED);
            run.logChange("Text field cleaned: '" + abbreviate(text) + "' -> '" + abbreviate(cleaned) + "'");
        }
        if (cleaned.isEmpty()) {
            run.increment(Statistic.EMPTY_VALUES_REMOVED);
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    /**
     * Punctuation spacing applied to every literal at serialization time.
     */
    public String fixPunctuationSpacing(String text) {
        if (text == null || text.isEmpty()) return text;
        String fixed = spacePunctuation(text).replaceAll("\\s{2,}", " ").trim();
        if (!fixed.equals(text)) {
            run.increment(Statistic.COMMA_FIXES);
            run.increment(Statistic.TEXT_FIELDS_CLEANED);
            run.logChange("Comma spacing fixed: '" + abbreviate(text) + "' -> '" + abbreviate(fixed) + "'");
        }
        return fixed;
    }

    static String spacePunctuation(String text) {
        String t = COMMA.matcher(text).replaceAll(", ");
        t = PERIOD.matcher(t).replaceAll(". ");
        t = SEMICOLON.matcher(t).replaceAll("; ");
        t = COLON.matcher(t).replaceAll(": ");
        t = EXCLAMATION.matcher(t).replaceAll("! ");
        return QUESTION.matcher(t).replaceAll("? ");
    }

    static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    static String abbreviate(String text) {
        return StringUtils.abbreviate(text.trim(), LOG_TEXT_LIMIT);
    }

    private static String replaceAll(String text, Map<String, String> table) {
        String result = text;
        for (Map.Entry<String, String> e : table.entrySet()) {
            result = result.replace(e.getKey(), e.getValue());
        }
        return result;
    }
}
