package com.phillippitts.lineaccuracy.presentation.dto;

import com.phillippitts.lineaccuracy.domain.LockedWordState;

/**
 * @param state    state to send back with the next call
 * @param complete whether the whole line has been spoken
 */
public record LockedMatchResponse(LockedWordState state, boolean complete) {
}
