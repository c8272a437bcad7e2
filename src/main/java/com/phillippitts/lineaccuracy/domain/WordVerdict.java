package com.phillippitts.lineaccuracy.domain;

/** Per-word outcome shown when rendering an attempt. */
public enum WordVerdict {
    CORRECT,
    WRONG,
    MISSING
}
