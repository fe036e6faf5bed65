package com.vidnyan.tabula.domain.code;

/**
 * Closed, inclusive interval of codes.
 */
public interface CodeRange {

    /**
     * Check whether a code falls within this range.
     * A code of the other kind (string vs. integer) is never contained.
     */
    boolean contains(Code code);
}
