package com.phillippitts.lineaccuracy.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void lineAccuracyExceptionShouldIncludeMessage() {
        LineAccuracyException ex = new LineAccuracyException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void lineAccuracyExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        LineAccuracyException ex = new LineAccuracyException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void wordTableExceptionShouldIncludeLocationAndReason() {
        WordTableException ex = new WordTableException("classpath:accuracy/equivalents.txt", "line 3: missing ':'");

        assertThat(ex.getMessage()).contains("classpath:accuracy/equivalents.txt");
        assertThat(ex.getMessage()).contains("line 3");
        assertThat(ex.getLocation()).isEqualTo("classpath:accuracy/equivalents.txt");
    }

    @Test
    void wordTableExceptionShouldIncludeCause() {
        IOException cause = new IOException("File not found");
        WordTableException ex = new WordTableException("file:/tmp/fillers.txt", cause);

        assertThat(ex.getMessage()).contains("file:/tmp/fillers.txt");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex.getLocation()).isEqualTo("file:/tmp/fillers.txt");
    }

    @Test
    void wordTableExceptionShouldExtendBase() {
        assertThat(new WordTableException("x", "y")).isInstanceOf(LineAccuracyException.class);
    }
}
