package com.vidnyan.tabula.application.port.out;

import com.vidnyan.tabula.domain.category.CategorySet;

import java.util.Optional;
import java.util.Set;

/**
 * Port for obtaining parsed CNV tables by name.
 * Implemented by adapters that read from files, classpath, etc.
 */
public interface CategorySetRepository {

    /**
     * Load a table by name (file name without the .cnv extension, lower case).
     */
    Optional<CategorySet> findByName(String name);

    /**
     * Names of all available tables.
     */
    Set<String> names();
}
