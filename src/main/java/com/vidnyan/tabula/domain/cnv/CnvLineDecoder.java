package com.vidnyan.tabula.domain.cnv;

import com.vidnyan.tabula.domain.code.Code;
import com.vidnyan.tabula.domain.code.CodeRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes one fixed-column CNV data line.
 *
 * <pre>
 *   Columns  1-3:   parent index     (blank for a root category)
 *   Columns  4-7:   category index   (required)
 *   Columns 10-59:  name
 *   Columns 61-:    comma-separated codes and ranges
 * </pre>
 */
public final class CnvLineDecoder {

    public static final char COMMENT_MARKER = ';';

    private static final int PARENT_START = 0;
    private static final int PARENT_END = 3;
    private static final int INDEX_START = 3;
    private static final int INDEX_END = 7;
    private static final int NAME_START = 9;
    private static final int NAME_END = 59;
    private static final int CODES_START = 60;

    private CnvLineDecoder() {
    }

    /**
     * Whether a line carries no category: blank or a {@code ;} comment.
     */
    public static boolean isSkippable(String line) {
        String content = line.strip();
        return content.isEmpty() || content.charAt(0) == COMMENT_MARKER;
    }

    /**
     * Decode a line, or return empty for blank and comment lines.
     *
     * @param lineNumber 1-based position of the line in its document, used in errors
     * @throws MalformedCategoryLineException if an index column is not an integer
     * @throws InvalidCodeException           if a code token cannot be parsed
     */
    public static Optional<RawCategoryRecord> decode(String line, int lineNumber, boolean letterCodes) {
        if (isSkippable(line)) {
            return Optional.empty();
        }

        String padded = line.length() < CODES_START ? String.format("%-" + CODES_START + "s", line) : line;

        Integer parentIdx = parseParent(padded.substring(PARENT_START, PARENT_END), line, lineNumber);
        int idx = parseIndex(padded.substring(INDEX_START, INDEX_END), line, lineNumber);
        String name = padded.substring(NAME_START, NAME_END).strip();
        String codeSpec = padded.substring(CODES_START).stripTrailing();

        List<Code> codes = new ArrayList<>();
        List<CodeRange> ranges = new ArrayList<>();
        if (!codeSpec.isEmpty()) {
            for (String token : codeSpec.split(",", -1)) {
                CodeToken parsed;
                try {
                    parsed = CodeTokenParser.parse(token, letterCodes);
                } catch (InvalidCodeException e) {
                    throw e.atLine(lineNumber);
                }
                if (parsed.isRange()) {
                    ranges.add(parsed.range());
                } else {
                    codes.add(parsed.code());
                }
            }
        }

        return Optional.of(RawCategoryRecord.builder()
                .idx(idx)
                .parentIdx(parentIdx)
                .name(name)
                .codeSpec(codeSpec)
                .codes(codes)
                .ranges(ranges)
                .lineNumber(lineNumber)
                .build());
    }

    private static Integer parseParent(String column, String line, int lineNumber) {
        if (column.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(column.strip());
        } catch (NumberFormatException e) {
            throw new MalformedCategoryLineException("invalid parent index '" + column + "'", line, lineNumber, e);
        }
    }

    private static int parseIndex(String column, String line, int lineNumber) {
        try {
            return Integer.parseInt(column.strip());
        } catch (NumberFormatException e) {
            throw new MalformedCategoryLineException("invalid category index '" + column + "'", line, lineNumber, e);
        }
    }
}
