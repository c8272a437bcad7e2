package com.phillippitts.lineaccuracy.service.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a line into short segments for build-mode practice, where the actor repeats a growing
 * prefix of the line one segment at a time.
 *
 * <p>Authored practice segments win when supplied; otherwise the line is chunked into groups of
 * {@value #CHUNK_SIZE} words. A segment with fewer than {@value #MIN_SEGMENT_WORDS} words is merged
 * into its neighbour so the actor never repeats a lone "Thanks."
 */
public final class LineSegmenter {

    static final int CHUNK_SIZE = 4;
    static final int MIN_SEGMENT_WORDS = 2;

    private LineSegmenter() {
    }

    /**
     * Segments a line.
     *
     * @param line             full script line (may contain parentheticals)
     * @param practiceSegments authored segments, or null/empty to chunk the line
     * @return immutable list of non-blank segments, parentheticals stripped
     */
    public static List<String> segment(String line, List<String> practiceSegments) {
        List<String> segments = new ArrayList<>();
        if (practiceSegments != null && !practiceSegments.isEmpty()) {
            for (String authored : practiceSegments) {
                segments.add(ScriptText.stripParentheticals(authored));
            }
        } else {
            String clean = ScriptText.stripParentheticals(line);
            if (!clean.isEmpty()) {
                String[] words = clean.split(" ");
                for (int i = 0; i < words.length; i += CHUNK_SIZE) {
                    int end = Math.min(i + CHUNK_SIZE, words.length);
                    segments.add(String.join(" ", List.of(words).subList(i, end)));
                }
            }
        }
        if (segments.size() > 1) {
            segments = mergeShortSegments(segments);
        }
        return segments.stream().filter(s -> !s.isBlank()).toList();
    }

    /**
     * Joins segments {@code 0..index} into the text the actor repeats at that build step.
     *
     * @param segments segments from {@link #segment(String, List)}
     * @param index    last segment to include, clamped to the available range
     * @return accumulated text, or "" when there are no segments
     */
    public static String accumulated(List<String> segments, int index) {
        if (segments == null || segments.isEmpty() || index < 0) {
            return "";
        }
        int last = Math.min(index, segments.size() - 1);
        return String.join(" ", segments.subList(0, last + 1));
    }

    private static List<String> mergeShortSegments(List<String> segments) {
        List<String> pending = new ArrayList<>(segments);
        List<String> merged = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            String current = pending.get(i);
            boolean tooShort = ScriptText.wordCount(current) < MIN_SEGMENT_WORDS;
            if (tooShort && !merged.isEmpty()) {
                int last = merged.size() - 1;
                merged.set(last, (merged.get(last) + " " + current).strip());
            } else if (tooShort && i < pending.size() - 1) {
                pending.set(i + 1, (current + " " + pending.get(i + 1)).strip());
            } else {
                merged.add(current);
            }
        }
        return merged;
    }
}
