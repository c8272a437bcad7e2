package com.phillippitts.lineaccuracy.domain;

import java.util.List;

/**
 * One verdict per expected word slot, with the spoken text aligned to each slot.
 *
 * @param results     verdicts in expected-word order
 * @param spokenWords spoken text aligned to each slot; empty for missing words and for the
 *                    trailing slots of a multi-word match
 */
public record WordByWordResult(List<WordVerdict> results, List<String> spokenWords) {

    public WordByWordResult {
        results = results == null ? List.of() : List.copyOf(results);
        spokenWords = spokenWords == null ? List.of() : List.copyOf(spokenWords);
        if (results.size() != spokenWords.size()) {
            throw new IllegalArgumentException("results and spokenWords must align: "
                    + results.size() + " vs " + spokenWords.size());
        }
    }
}
