package com.vidnyan.tabula.domain.code;

import java.util.Objects;

/**
 * String code. Whitespace is significant: {@code "  "} is a valid code of its own.
 */
public record StrCode(String value) implements Code {

    public StrCode {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return "'" + value + "'";
    }
}
