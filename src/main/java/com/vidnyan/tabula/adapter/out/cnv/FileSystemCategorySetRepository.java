package com.vidnyan.tabula.adapter.out.cnv;

import com.vidnyan.tabula.TabulaProperties;
import com.vidnyan.tabula.application.port.out.CategorySetRepository;
import com.vidnyan.tabula.domain.category.CategorySet;
import com.vidnyan.tabula.domain.cnv.CnvParseException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File system based CNV table repository.
 * Loads every CNV file matching the configured resource pattern at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemCategorySetRepository implements CategorySetRepository {

    private static final String CNV_EXTENSION = ".cnv";

    private final TabulaProperties properties;

    private final Map<String, CategorySet> tables = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadTables() {
        String location = properties.getCnv().getLocation();
        Charset charset = Charset.forName(properties.getCnv().getCharset());
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(location);

            for (Resource resource : resources) {
                String filename = resource.getFilename();
                if (filename == null) {
                    continue;
                }
                try {
                    CategorySet categorySet = CategorySet.fromCnv(resource.getContentAsString(charset));
                    String name = tableName(filename);
                    tables.put(name, categorySet);
                    log.info("Loaded CNV table: {} - {} roots, {} categories",
                            name, categorySet.size(), categorySet.flatCategories().size());
                } catch (CnvParseException | IOException e) {
                    log.warn("Failed to load CNV table from {}: {}", filename, e.getMessage());
                }
            }

            log.info("Loaded {} CNV tables from {}", tables.size(), location);
        } catch (IOException e) {
            log.error("Failed to load CNV tables", e);
        }
    }

    /**
     * Add or replace a table under the given name.
     */
    public void register(String name, CategorySet categorySet) {
        tables.put(name.toLowerCase(Locale.ROOT), categorySet);
    }

    @Override
    public Optional<CategorySet> findByName(String name) {
        return Optional.ofNullable(tables.get(name.toLowerCase(Locale.ROOT)));
    }

    @Override
    public Set<String> names() {
        return new TreeSet<>(tables.keySet());
    }

    static String tableName(String filename) {
        String name = filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(CNV_EXTENSION)) {
            name = name.substring(0, name.length() - CNV_EXTENSION.length());
        }
        return name;
    }
}
