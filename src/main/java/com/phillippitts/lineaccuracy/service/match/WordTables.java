package com.phillippitts.lineaccuracy.service.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup tables shared read-only by every comparison.
 *
 * <p>The equivalence table is directed: each key lists the words or phrases a recognizer may emit for
 * it. Callers wanting symmetric behaviour check both operands as keys, which
 * {@link #areEquivalent(String, String)} does.
 */
public final class WordTables {

    private final Map<String, Set<String>> equivalents;
    private final Map<String, List<List<String>>> phrases;
    private final Set<String> skippable;
    private final Set<String> fillers;

    /**
     * Creates tables from already-normalized entries.
     *
     * @param equivalents word to interchangeable words or phrases, iteration order preserved
     * @param skippable   script words that may go unspoken without penalty
     * @param fillers     spoken words ignored when they do not appear in the line
     */
    public WordTables(Map<String, ? extends Set<String>> equivalents, Set<String> skippable, Set<String> fillers) {
        Map<String, Set<String>> copy = new HashMap<>();
        Map<String, List<List<String>>> multiWord = new HashMap<>();
        equivalents.forEach((word, alternatives) -> {
            copy.put(word, Collections.unmodifiableSet(new LinkedHashSet<>(alternatives)));
            List<List<String>> expansions = new ArrayList<>();
            for (String alternative : alternatives) {
                if (alternative.indexOf(' ') >= 0) {
                    expansions.add(List.of(alternative.split(" ")));
                }
            }
            if (!expansions.isEmpty()) {
                multiWord.put(word, List.copyOf(expansions));
            }
        });
        this.equivalents = Map.copyOf(copy);
        this.phrases = Map.copyOf(multiWord);
        this.skippable = Set.copyOf(skippable);
        this.fillers = Set.copyOf(fillers);
    }

    /**
     * Returns the interchangeable forms listed for a word.
     *
     * @param word normalized word
     * @return alternatives in table order, empty if none
     */
    public Set<String> equivalents(String word) {
        return equivalents.getOrDefault(word, Set.of());
    }

    /**
     * Returns the multi-word phrases listed for a word, each split into words.
     *
     * @param word normalized word
     * @return phrases in table order, empty if none
     */
    public List<List<String>> multiWordEquivalents(String word) {
        return phrases.getOrDefault(word, List.of());
    }

    /**
     * Checks the equivalence table with either word as the key.
     *
     * @param first  normalized word
     * @param second normalized word
     * @return true if either word lists the other
     */
    public boolean areEquivalent(String first, String second) {
        return equivalents(first).contains(second) || equivalents(second).contains(first);
    }

    public boolean isSkippable(String word) {
        return skippable.contains(word);
    }

    public boolean isFiller(String word) {
        return fillers.contains(word);
    }

    int equivalentCount() {
        return equivalents.size();
    }

    int skippableCount() {
        return skippable.size();
    }

    int fillerCount() {
        return fillers.size();
    }
}
