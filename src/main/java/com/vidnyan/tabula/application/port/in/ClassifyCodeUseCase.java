package com.vidnyan.tabula.application.port.in;

import com.vidnyan.tabula.domain.category.Category;
import com.vidnyan.tabula.domain.code.Code;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Primary use case: classify a raw data code against a named CNV table.
 */
public interface ClassifyCodeUseCase {

    /**
     * Classify a raw code as read from a data file.
     * @param table   CNV table name
     * @param rawCode code text; digit-only codes are matched as integers unless the table uses letter codes
     * @return the classification, or empty if no category contains the code
     * @throws com.vidnyan.tabula.domain.category.CategoryNotFoundException if the table does not exist
     */
    Optional<Classification> classify(String table, String rawCode);

    /**
     * Classification result.
     */
    record Classification(
        String table,
        Code code,
        List<Category> path
    ) {

        public Category root() {
            return path.get(0);
        }

        public Category leaf() {
            return path.get(path.size() - 1);
        }

        /**
         * Format the path for display.
         */
        public String formattedPath() {
            return path.stream()
                    .map(Category::name)
                    .collect(Collectors.joining(" → "));
        }
    }
}
