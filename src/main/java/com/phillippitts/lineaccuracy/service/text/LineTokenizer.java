package com.phillippitts.lineaccuracy.service.text;

import com.phillippitts.lineaccuracy.domain.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility for turning script lines and transcripts into comparable words.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Script lines: dash runs become spaces so a written stutter ("I--I", "I-I") yields repeated
 *       words; other punctuation except apostrophes becomes a space; original casing is kept</li>
 *   <li>Transcripts: the same splitting, lower-cased, so a line read back verbatim always tokenizes
 *       exactly like the script</li>
 *   <li>Whitespace collapsed, blank tokens dropped, immutable lists returned</li>
 * </ul>
 */
public final class LineTokenizer {

    private static final Pattern DASH_RUN = Pattern.compile("-+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s\\h']");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\h]+");

    private LineTokenizer() {
        // Prevent instantiation
    }

    /**
     * Tokenizes an expected script line.
     *
     * @param line script line (may be null or blank)
     * @return immutable list of tokens in line order (empty if no words)
     */
    public static List<Token> tokenizeScript(String line) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        String spaced = PUNCTUATION.matcher(splitStutters(line)).replaceAll(" ");
        List<Token> tokens = new ArrayList<>();
        for (String word : WHITESPACE.split(spaced.strip())) {
            if (!word.isEmpty()) {
                tokens.add(new Token(word.toLowerCase(Locale.ROOT), word, tokens.isEmpty()));
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Tokenizes spoken text as delivered by a speech recognizer.
     *
     * @param transcript accumulated transcript (may be null or blank)
     * @return immutable list of lower-case words (empty if no words)
     */
    public static List<String> tokenizeSpoken(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return List.of();
        }
        String cleaned = PUNCTUATION.matcher(splitStutters(transcript)).replaceAll(" ").toLowerCase(Locale.ROOT);
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(cleaned.strip())) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return List.copyOf(words);
    }

    /**
     * Replaces every run of dashes with a single space.
     *
     * @param text text to process (never null)
     * @return text with stutter dashes split into separate words
     */
    static String splitStutters(String text) {
        return DASH_RUN.matcher(text).replaceAll(" ");
    }

    /**
     * Extracts the normalized words of a tokenized script line.
     *
     * @param tokens script tokens
     * @return immutable list of normalized words
     */
    public static List<String> normalizedWords(List<Token> tokens) {
        List<String> words = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            words.add(token.normalized());
        }
        return List.copyOf(words);
    }
}
