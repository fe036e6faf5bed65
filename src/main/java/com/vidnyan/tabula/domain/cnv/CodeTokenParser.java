package com.vidnyan.tabula.domain.cnv;

import com.vidnyan.tabula.domain.code.IntCode;
import com.vidnyan.tabula.domain.code.IntRange;
import com.vidnyan.tabula.domain.code.StrCode;
import com.vidnyan.tabula.domain.code.StrRange;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one comma-separated token of a CNV code column.
 *
 * <p>Numeric patterns are tried first unless the table uses letter codes; the
 * string patterns are the fallback in both modes, so {@code "A0-A9"} is always
 * a string range.
 */
public final class CodeTokenParser {

    private static final Pattern INT_CODE = Pattern.compile("^\\d+$");
    private static final Pattern INT_RANGE = Pattern.compile("^(\\d+)-(\\d+)$");
    private static final Pattern STR_CODE = Pattern.compile("^[^-,]+$");
    private static final Pattern STR_RANGE = Pattern.compile("^([^-,]+)-([^-,]+)$");

    private CodeTokenParser() {
    }

    /**
     * Parse a token into either a code or a range.
     *
     * @throws InvalidCodeException if no pattern matches
     */
    public static CodeToken parse(String token, boolean letterCodes) {
        if (!letterCodes) {
            if (INT_CODE.matcher(token).matches()) {
                return CodeToken.of(new IntCode(toInt(token, token)));
            }
            Matcher range = INT_RANGE.matcher(token);
            if (range.matches()) {
                return CodeToken.of(new IntRange(toInt(range.group(1), token), toInt(range.group(2), token)));
            }
        }

        if (STR_CODE.matcher(token).matches()) {
            return CodeToken.of(new StrCode(token));
        }
        Matcher range = STR_RANGE.matcher(token);
        if (range.matches()) {
            return CodeToken.of(new StrRange(range.group(1), range.group(2)));
        }

        throw new InvalidCodeException(token);
    }

    private static int toInt(String digits, String token) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new InvalidCodeException(token, 0, e);
        }
    }
}
