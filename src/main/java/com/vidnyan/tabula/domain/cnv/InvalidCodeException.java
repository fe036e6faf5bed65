package com.vidnyan.tabula.domain.cnv;

import lombok.Getter;

/**
 * A code token that is neither a code nor a range.
 */
@Getter
public class InvalidCodeException extends CnvParseException {

    private final String token;

    public InvalidCodeException(String token) {
        this(token, 0, null);
    }

    public InvalidCodeException(String token, int lineNumber, Throwable cause) {
        super("invalid code '" + token + "'", lineNumber, cause);
        this.token = token;
    }

    /**
     * Same error, tagged with the line it was found on.
     */
    public InvalidCodeException atLine(int lineNumber) {
        return new InvalidCodeException(token, lineNumber, this);
    }
}
