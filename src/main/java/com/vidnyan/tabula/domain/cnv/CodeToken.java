package com.vidnyan.tabula.domain.cnv;

import com.vidnyan.tabula.domain.code.Code;
import com.vidnyan.tabula.domain.code.CodeRange;

/**
 * One parsed entry of a code column: exactly one of {@code code} or {@code range} is set.
 */
public record CodeToken(
    Code code,
    CodeRange range
) {

    public static CodeToken of(Code code) {
        return new CodeToken(code, null);
    }

    public static CodeToken of(CodeRange range) {
        return new CodeToken(null, range);
    }

    public boolean isRange() {
        return range != null;
    }
}
