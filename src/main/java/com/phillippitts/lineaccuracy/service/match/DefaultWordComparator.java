package com.phillippitts.lineaccuracy.service.match;

import com.phillippitts.lineaccuracy.service.match.similarity.JaroWinkler;
import com.phillippitts.lineaccuracy.service.match.similarity.Levenshtein;
import org.apache.commons.codec.language.Soundex;

import java.util.Objects;

/**
 * Word comparator tuned for noisy speech recognition.
 *
 * <p>Checks run in order and stop at the first success:
 * <ol>
 *   <li>exact equality</li>
 *   <li>equivalence table, either word as key (homophones, abbreviations, numerals, filler sounds)</li>
 *   <li>Jaro-Winkler at or above the name threshold, only for proper nouns and known names</li>
 *   <li>edit distance of 1 when either word has at most 5 letters, 2 when both have 6 or more</li>
 *   <li>equal Soundex codes for words of 2+ characters</li>
 * </ol>
 *
 * <p>Ordinary words never fuzzy-match, so "old" is never accepted for "young".
 */
public final class DefaultWordComparator implements WordComparator {

    static final int SHORT_WORD_MAX_LENGTH = 5;
    static final int LONG_WORD_MIN_LENGTH = 6;
    static final int MIN_PHONETIC_LENGTH = 2;

    private final WordTables tables;
    private final double nameSimilarityThreshold;
    private final Soundex soundex = new Soundex();

    /**
     * Creates a comparator.
     *
     * @param tables                  equivalence data
     * @param nameSimilarityThreshold minimum Jaro-Winkler similarity for names (0.0 to 1.0)
     * @throws IllegalArgumentException if the threshold is not in [0,1]
     */
    public DefaultWordComparator(WordTables tables, double nameSimilarityThreshold) {
        if (nameSimilarityThreshold < 0.0 || nameSimilarityThreshold > 1.0) {
            throw new IllegalArgumentException("name similarity threshold in [0,1]");
        }
        this.tables = Objects.requireNonNull(tables);
        this.nameSimilarityThreshold = nameSimilarityThreshold;
    }

    @Override
    public boolean wordsMatch(String expected, String spoken, String expectedOriginal,
                              boolean firstPosition, KnownNames knownNames) {
        if (expected.equals(spoken)) {
            return true;
        }
        if (tables.areEquivalent(expected, spoken)) {
            return true;
        }
        if (isName(expected, expectedOriginal, firstPosition, knownNames)
                && JaroWinkler.similarity(expected, spoken) >= nameSimilarityThreshold) {
            return true;
        }
        if (withinEditBudget(expected, spoken)) {
            return true;
        }
        return soundsAlike(expected, spoken);
    }

    /**
     * A word is a name when the script capitalizes it mid-line or the caller lists it.
     */
    static boolean isProperNoun(String original, boolean firstPosition) {
        if (original == null || original.isEmpty() || firstPosition) {
            return false;
        }
        return Character.isUpperCase(original.charAt(0));
    }

    private static boolean isName(String expected, String original, boolean firstPosition, KnownNames knownNames) {
        return isProperNoun(original, firstPosition) || (knownNames != null && knownNames.contains(expected));
    }

    private static boolean withinEditBudget(String expected, String spoken) {
        if (expected.length() <= SHORT_WORD_MAX_LENGTH || spoken.length() <= SHORT_WORD_MAX_LENGTH) {
            if (Levenshtein.distance(expected, spoken) <= 1) {
                return true;
            }
        }
        return expected.length() >= LONG_WORD_MIN_LENGTH
                && spoken.length() >= LONG_WORD_MIN_LENGTH
                && Levenshtein.distance(expected, spoken) <= 2;
    }

    private boolean soundsAlike(String expected, String spoken) {
        if (expected.length() < MIN_PHONETIC_LENGTH || spoken.length() < MIN_PHONETIC_LENGTH) {
            return false;
        }
        String expectedCode = soundex.soundex(expected);
        // Words without letters (bare numerals) have no code
        return expectedCode != null && !expectedCode.isEmpty() && expectedCode.equals(soundex.soundex(spoken));
    }
}
