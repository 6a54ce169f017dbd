package com.e2eq.skos.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits document text into concept-sized blocks.
 * <p>
 * A line of the form {@code <subject> a skos:Concept} opens a block; a line that is
 * exactly {@code .} closes it. Any other subject declaration (a ConceptScheme for
 * instance) or a directive closes the current block without opening a new one, so
 * non-concept resources never leak into a concept block.
 * </p>
 */
public final class ConceptBlockSegmenter {

    public static final String IDENTIFIER = "(<[^>]+>|[a-zA-Z0-9_:/-]+)";
    static final Pattern SUBJECT_LINE = Pattern.compile("^" + IDENTIFIER + "\\s+a\\s+(\\S+?)(?=[\\s;,.]|$)");
    static final String CONCEPT_TYPE = "skos:Concept";

    private enum State { OUTSIDE_BLOCK, IN_BLOCK }

    public List<String> segment(String content, CleaningRun run) {
        List<String> blocks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        State state = State.OUTSIDE_BLOCK;

        for (String raw : content.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            Matcher m = SUBJECT_LINE.matcher(line);
            if (m.find()) {
                if (state == State.IN_BLOCK) flush(current, blocks);
                if (CONCEPT_TYPE.equals(m.group(2))) {
                    current.add(line);
                    state = State.IN_BLOCK;
                } else {
                    state = State.OUTSIDE_BLOCK;
                }
                continue;
            }
            if (line.startsWith("@")) {
                if (state == State.IN_BLOCK) flush(current, blocks);
                state = State.OUTSIDE_BLOCK;
                continue;
            }

            switch (state) {
                case IN_BLOCK:
                    current.add(line);
                    if (line.equals(".")) {
                        flush(current, blocks);
                        state = State.OUTSIDE_BLOCK;
                    }
                    break;
                case OUTSIDE_BLOCK:
                default:
                    break;
            }
        }
        // unterminated trailing content is still a block
        if (state == State.IN_BLOCK) flush(current, blocks);

        if (run != null) run.set(Statistic.TOTAL_CONCEPTS, blocks.size());
        return blocks;
    }

    /**
     * True when the line declares a subject typed exactly {@code skos:Concept}.
     */
    public static boolean isConceptDeclaration(String line) {
        Matcher m = SUBJECT_LINE.matcher(line.trim());
        return m.find() && CONCEPT_TYPE.equals(m.group(2));
    }

    private static void flush(List<String> current, List<String> blocks) {
        if (!current.isEmpty()) {
            blocks.add(String.join("\n", current));
            current.clear();
        }
    }
}
