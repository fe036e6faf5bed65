package com.vidnyan.tabula.domain.code;

import java.util.Objects;

/**
 * Inclusive lexicographic range over fixed-width string codes.
 *
 * <p>Besides the lexicographic bounds, a candidate's length must lie between the
 * shorter and the longer bound length, so {@code "A100"} is not inside
 * {@code A01-A98} even though it sorts between them.
 */
public record StrRange(String start, String end) implements CodeRange {

    public StrRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public boolean contains(String value) {
        int minLength = Math.min(start.length(), end.length());
        int maxLength = Math.max(start.length(), end.length());
        if (value.length() < minLength || value.length() > maxLength) {
            return false;
        }
        return start.compareTo(value) <= 0 && value.compareTo(end) <= 0;
    }

    @Override
    public boolean contains(Code code) {
        return code instanceof StrCode strCode && contains(strCode.value());
    }

    @Override
    public String toString() {
        return "'" + start + "'-'" + end + "'";
    }
}
