package com.vidnyan.tabula.domain.cnv;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the CNV header line: {@code <count> <code length> [L]}.
 */
public final class CnvHeaderParser {

    private static final Pattern HEADER = Pattern.compile("^\\s*(\\d+)\\s+(\\d+)(?:\\s+(\\S+))?\\s*$");
    private static final String LETTER_CODES_MARKER = "L";

    private CnvHeaderParser() {
    }

    /**
     * Parse the first line of a document.
     *
     * @throws InvalidHeaderException if the line has the wrong shape or an unknown marker
     */
    public static CnvHeader parse(String line) {
        Matcher m = HEADER.matcher(line);
        if (!m.matches()) {
            throw new InvalidHeaderException(line);
        }

        String marker = m.group(3);
        if (marker != null && !LETTER_CODES_MARKER.equals(marker)) {
            throw new InvalidHeaderException(line);
        }

        try {
            return new CnvHeader(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    marker != null
            );
        } catch (NumberFormatException e) {
            InvalidHeaderException error = new InvalidHeaderException(line);
            error.initCause(e);
            throw error;
        }
    }
}
