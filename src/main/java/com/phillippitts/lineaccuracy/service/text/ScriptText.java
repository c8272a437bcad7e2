package com.phillippitts.lineaccuracy.service.text;

import java.util.regex.Pattern;

/** Cleanup applied to a script line before it is used as the expected text. */
public final class ScriptText {

    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ScriptText() {
    }

    /**
     * Removes parenthetical stage directions such as "(beat)" or "(to Sam)".
     *
     * @param line script line (may be null)
     * @return the line without parentheticals, whitespace collapsed and trimmed; "" for null
     */
    public static String stripParentheticals(String line) {
        if (line == null) {
            return "";
        }
        String stripped = PARENTHETICAL.matcher(line).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").strip();
    }

    /**
     * Counts whitespace-separated words.
     *
     * @param text text to count (may be null)
     * @return number of non-blank words
     */
    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.strip()).length;
    }
}
