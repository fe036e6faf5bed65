package com.vidnyan.tabula.application.service;

import com.vidnyan.tabula.application.port.in.ClassifyCodeUseCase.Classification;
import com.vidnyan.tabula.application.port.out.CategorySetRepository;
import com.vidnyan.tabula.domain.category.CategoryNotFoundException;
import com.vidnyan.tabula.domain.category.CategorySet;
import com.vidnyan.tabula.domain.code.Code;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationServiceTest {

    private static final String REGIAO_UF = String.join("\n",
            "      2 2",
            "      1  Regiao Norte",
            "  1  11  Rondonia                                           11",
            "  1  12  Acre                                               12",
            "      3  Regiao Sudeste",
            "  3  35  Sao Paulo                                          35");

    private static final String REGIOES = String.join("\n",
            "      1 2 L",
            "      4  Sudeste                                            MG,SP,RJ,ES");

    private final Map<String, CategorySet> tables = Map.of(
            "regiao_uf", CategorySet.fromCnv(REGIAO_UF),
            "regioes", CategorySet.fromCnv(REGIOES));

    private final ClassificationService service = new ClassificationService(new CategorySetRepository() {
        @Override
        public Optional<CategorySet> findByName(String name) {
            return Optional.ofNullable(tables.get(name));
        }

        @Override
        public Set<String> names() {
            return tables.keySet();
        }
    });

    @Test
    void classify_NumericTable_ShouldCoerceDigitsAndReturnPath() {
        Classification result = service.classify("regiao_uf", "35").orElseThrow();

        assertEquals("regiao_uf", result.table());
        assertEquals(Code.of(35), result.code());
        assertEquals("Regiao Sudeste", result.root().name());
        assertEquals("Sao Paulo", result.leaf().name());
        assertEquals("Regiao Sudeste → Sao Paulo", result.formattedPath());
    }

    @Test
    void classify_LetterTable_ShouldKeepStrings() {
        Classification result = service.classify("regioes", "SP").orElseThrow();

        assertEquals(Code.of("SP"), result.code());
        assertEquals(1, result.path().size());
        assertEquals("Sudeste", result.leaf().name());
    }

    @Test
    void classify_UnknownCode_ShouldBeEmpty() {
        assertTrue(service.classify("regiao_uf", "99").isEmpty());
        assertTrue(service.classify("regiao_uf", "AB").isEmpty());
    }

    @Test
    void classify_UnknownTable_ShouldThrow() {
        CategoryNotFoundException e = assertThrows(CategoryNotFoundException.class,
                () -> service.classify("municipios", "35"));
        assertTrue(e.getMessage().contains("municipios"));
    }
}
