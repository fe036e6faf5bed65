package com.vidnyan.tabula.domain.code;

/**
 * Inclusive integer range. Bounds are kept as declared; a range whose start
 * exceeds its end contains nothing.
 */
public record IntRange(int start, int end) implements CodeRange {

    public boolean contains(int value) {
        return start <= value && value <= end;
    }

    @Override
    public boolean contains(Code code) {
        return code instanceof IntCode intCode && contains(intCode.value());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
