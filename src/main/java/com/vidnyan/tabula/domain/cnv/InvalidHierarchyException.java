package com.vidnyan.tabula.domain.cnv;

import lombok.Getter;

/**
 * Parent references that do not form a forest.
 */
@Getter
public class InvalidHierarchyException extends CnvParseException {

    public enum Reason {
        MISSING_PARENT, // parent index never declared as a category
        CYCLE           // parent chain leads back to the category itself
    }

    private final Reason reason;
    private final int categoryIdx;

    public InvalidHierarchyException(Reason reason, int categoryIdx, String detail, int lineNumber) {
        super("category " + categoryIdx + ": " + detail, lineNumber);
        this.reason = reason;
        this.categoryIdx = categoryIdx;
    }
}
