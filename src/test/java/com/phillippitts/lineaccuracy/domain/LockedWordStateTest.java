package com.phillippitts.lineaccuracy.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LockedWordStateTest {

    @Test
    void freshStateIsEmpty() {
        LockedWordState state = LockedWordState.fresh();

        assertThat(state.lockedWords()).isEmpty();
        assertThat(state.lockedCount()).isZero();
        assertThat(state.hasError()).isFalse();
        assertThat(state.expectedIndex()).isZero();
    }

    @Test
    void shouldRejectNegativeLockedCount() {
        assertThatThrownBy(() -> new LockedWordState(List.of(), -1, false, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lockedCount");
    }

    @Test
    void shouldRaiseResumeIndexToLockedCount() {
        // Clients that only persist words and count send a zero index
        LockedWordState state = new LockedWordState(List.of("i", "am"), 2, false, 0);

        assertThat(state.expectedIndex()).isEqualTo(2);
    }

    @Test
    void shouldKeepResumeIndexPastSkippedWords() {
        LockedWordState state = new LockedWordState(List.of("i", "am"), 2, false, 3);

        assertThat(state.expectedIndex()).isEqualTo(3);
    }

    @Test
    void shouldTreatNullWordsAsEmpty() {
        assertThat(new LockedWordState(null, 0, false, 0).lockedWords()).isEmpty();
    }
}
