package com.vidnyan.tabula.domain.time;

/**
 * A year outside the two-digit window, or a two-digit year outside 00..99.
 */
public class YearOutOfRangeException extends IllegalArgumentException {

    public YearOutOfRangeException(String message) {
        super(message);
    }
}
