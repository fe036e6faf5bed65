package com.vidnyan.tabula.domain.code;

/**
 * Integer code, as found in purely numeric classification tables.
 */
public record IntCode(int value) implements Code {

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
