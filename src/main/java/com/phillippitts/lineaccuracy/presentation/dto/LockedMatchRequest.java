package com.phillippitts.lineaccuracy.presentation.dto;

import com.phillippitts.lineaccuracy.domain.LockedWordState;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * @param expected       the line as written
 * @param spoken         the accumulated transcript
 * @param previous       state returned by the previous call, null for a new line
 * @param knownNames     names eligible for fuzzy matching, used as given
 * @param characterNames character names, split into known names
 */
public record LockedMatchRequest(
        @NotNull String expected,
        @NotNull String spoken,
        LockedWordState previous,
        List<String> knownNames,
        List<String> characterNames
) {
}
