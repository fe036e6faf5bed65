package com.vidnyan.tabula.domain.cnv;

import lombok.Getter;

/**
 * The first line of a CNV document does not declare "count width [L]".
 */
@Getter
public class InvalidHeaderException extends CnvParseException {

    private final String header;

    public InvalidHeaderException(String header) {
        super("invalid CNV header '" + header + "'", 1);
        this.header = header;
    }
}
