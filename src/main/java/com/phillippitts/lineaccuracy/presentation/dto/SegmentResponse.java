package com.phillippitts.lineaccuracy.presentation.dto;

import java.util.List;

/**
 * @param segments    build-mode segments in order
 * @param accumulated for each segment, the text from the start of the line through it
 */
public record SegmentResponse(List<String> segments, List<String> accumulated) {
}
