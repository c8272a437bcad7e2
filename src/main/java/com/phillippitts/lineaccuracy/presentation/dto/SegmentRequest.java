package com.phillippitts.lineaccuracy.presentation.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * @param line             the line as written
 * @param practiceSegments author-defined segments, or null to chunk automatically
 */
public record SegmentRequest(@NotNull String line, List<String> practiceSegments) {
}
