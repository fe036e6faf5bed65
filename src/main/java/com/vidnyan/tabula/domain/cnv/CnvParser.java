package com.vidnyan.tabula.domain.cnv;

import com.vidnyan.tabula.domain.category.Category;
import com.vidnyan.tabula.domain.category.CategorySet;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses CNV documents into {@link CategorySet}s.
 *
 * <p>The first line is the header; every following line is decoded on its own,
 * blank and comment lines are skipped, and the decoded records are assembled
 * into the category forest. Any structural error aborts the parse.
 */
@Slf4j
public final class CnvParser {

    private CnvParser() {
    }

    /**
     * Parse the full text of a CNV document.
     *
     * @throws CnvParseException on the first header, line, code or hierarchy error
     */
    public static CategorySet parse(String contents) {
        List<String> lines = contents.lines().toList();
        if (lines.isEmpty()) {
            throw new InvalidHeaderException("");
        }

        CnvHeader header = CnvHeaderParser.parse(lines.get(0));

        List<RawCategoryRecord> records = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            int lineNumber = i + 1;
            Optional<RawCategoryRecord> record = CnvLineDecoder.decode(lines.get(i), lineNumber, header.letterCodes());
            if (record.isPresent()) {
                RawCategoryRecord decoded = record.get();
                log.debug("Line {}: category {} '{}' (parent {}), {} codes, {} ranges",
                        lineNumber, decoded.idx(), decoded.name(), decoded.parentIdx(),
                        decoded.codes().size(), decoded.ranges().size());
                records.add(decoded);
            } else {
                log.debug("Line {}: skipped", lineNumber);
            }
        }

        List<Category> roots = CategoryTreeBuilder.build(records);
        CategorySet categorySet = new CategorySet(header.declaredCount(), header.codeLength(),
                header.letterCodes(), roots);

        log.debug("Parsed CNV: {} lines, {} records, {} roots, {} categories",
                lines.size(), records.size(), roots.size(), categorySet.flatCategories().size());
        if (header.declaredCount() != roots.size()) {
            log.debug("Header declares {} categories but {} roots were parsed",
                    header.declaredCount(), roots.size());
        }
        return categorySet;
    }

    /**
     * Read a CNV file with the given charset and parse it.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public static CategorySet parseFile(Path path, Charset charset) {
        String contents;
        try {
            contents = Files.readString(path, charset);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CNV file " + path, e);
        }
        log.debug("Read {} ({} chars, {})", path, contents.length(), charset.name());
        return parse(contents);
    }
}
