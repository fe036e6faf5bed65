package com.vidnyan.tabula.application.service;

import com.vidnyan.tabula.application.port.in.ClassifyCodeUseCase;
import com.vidnyan.tabula.application.port.out.CategorySetRepository;
import com.vidnyan.tabula.domain.category.Category;
import com.vidnyan.tabula.domain.category.CategoryNotFoundException;
import com.vidnyan.tabula.domain.category.CategorySet;
import com.vidnyan.tabula.domain.code.Code;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Classifies raw codes against the tables of the repository.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationService implements ClassifyCodeUseCase {

    private final CategorySetRepository categorySetRepository;

    @Override
    public Optional<Classification> classify(String table, String rawCode) {
        CategorySet categorySet = categorySetRepository.findByName(table)
                .orElseThrow(() -> CategoryNotFoundException.forTable(table));

        Code code = categorySet.parseCode(rawCode);
        Optional<List<Category>> path = categorySet.findPath(code);
        if (path.isEmpty()) {
            log.debug("[{}] No category contains {}", table, code);
            return Optional.empty();
        }

        Classification classification = new Classification(table, code, path.get());
        log.debug("[{}] {} -> {}", table, code, classification.formattedPath());
        return Optional.of(classification);
    }
}
