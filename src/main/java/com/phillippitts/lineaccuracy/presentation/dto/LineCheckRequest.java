package com.phillippitts.lineaccuracy.presentation.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * A line and a transcript to compare.
 *
 * @param expected       the line as written
 * @param spoken         the transcript
 * @param strict         strict mode, or null for the configured default
 * @param knownNames     names eligible for fuzzy matching, used as given
 * @param characterNames character names, split into known names
 */
public record LineCheckRequest(
        @NotNull String expected,
        @NotNull String spoken,
        Boolean strict,
        List<String> knownNames,
        List<String> characterNames
) {
}
