package com.vidnyan.tabula.domain.cnv;

import lombok.Getter;

/**
 * A data line whose parent or category index column is not an integer.
 */
@Getter
public class MalformedCategoryLineException extends CnvParseException {

    private final String line;

    public MalformedCategoryLineException(String reason, String line, int lineNumber, Throwable cause) {
        super(reason + " in '" + line + "'", lineNumber, cause);
        this.line = line;
    }
}
