package com.vidnyan.tabula.domain.cnv;

import lombok.Getter;

/**
 * Base class for structural errors found while parsing a CNV document.
 * Aborts the whole parse; a partially built table is never returned.
 */
@Getter
public class CnvParseException extends RuntimeException {

    /**
     * 1-based line the error was found on, or 0 when not tied to a line.
     */
    private final int lineNumber;

    public CnvParseException(String message, int lineNumber) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public CnvParseException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }
}
