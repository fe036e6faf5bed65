package com.vidnyan.tabula.domain.category;

/**
 * A lookup by category index, by code or by table name matched nothing.
 */
public class CategoryNotFoundException extends RuntimeException {

    public CategoryNotFoundException(String message) {
        super(message);
    }

    public static CategoryNotFoundException forIndex(int idx) {
        return new CategoryNotFoundException("no category with index " + idx);
    }

    public static CategoryNotFoundException forCode(Object code) {
        return new CategoryNotFoundException("no category contains code " + code);
    }

    public static CategoryNotFoundException forTable(String table) {
        return new CategoryNotFoundException("no CNV table named '" + table + "'");
    }
}
