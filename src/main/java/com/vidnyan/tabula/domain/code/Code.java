package com.vidnyan.tabula.domain.code;

import java.util.regex.Pattern;

/**
 * A single classification value: either an integer or a string.
 * Codes of different kinds never compare equal, so {@code "02"} and {@code 2} are distinct.
 */
public interface Code {

    Pattern DIGITS = Pattern.compile("^\\d+$");

    /**
     * Create an integer code.
     */
    static Code of(int value) {
        return new IntCode(value);
    }

    /**
     * Create a string code.
     */
    static Code of(String value) {
        return new StrCode(value);
    }

    /**
     * Coerce a raw value read from a data file.
     * Digit-only values become integer codes unless the table uses letter codes.
     */
    static Code parse(String raw, boolean letterCodes) {
        if (!letterCodes && DIGITS.matcher(raw).matches()) {
            try {
                return new IntCode(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                return new StrCode(raw);
            }
        }
        return new StrCode(raw);
    }
}
