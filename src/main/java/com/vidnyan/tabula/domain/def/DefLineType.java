package com.vidnyan.tabula.domain.def;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Line-type markers of DEF tabulation-definition files, the companion format of CNV.
 * Only the vocabulary is modelled; DEF files are not parsed.
 */
public enum DefLineType {
    COMMENT(';', "Title or comment"),
    HTML_BEFORE('H', "HTML shown before the form and the tabulation result"),
    HTML_AFTER('F', "HTML shown after the form and the tabulation result"),
    FILE_PATTERN('A', "Name pattern of the data files"),
    SELECTION_VAR_DEF('S', "Selection variable"),
    LINE_VAR_DEF('L', "Row variable"),
    COLUMN_VAR_DEF('C', "Column variable"),
    DOUBLE_VAR_DEF('D', "Row and panel variable"),
    TRIPLE_VAR_DEF('T', "Row, column and panel variable"),
    INCREMENT_VAR_DEF('I', "Content variable for flows (increment or indicator)"),
    ACCUMULATOR_VAR_DEF('E', "Content variable for stocks or balances"),
    PROPORTION_RESULT('%', "Result shown as a proportion"),
    FORMATTING_OPTIONS('O', "Form and result formatting options"),
    OPTION_X('X', "Undocumented"),
    OPTION_N('N', "Undocumented"),
    OPTION_R('R', "Undocumented"),
    OPTION_G('G', "Undocumented");

    private static final Map<Character, DefLineType> BY_MARKER = Arrays.stream(values())
            .collect(Collectors.toMap(DefLineType::marker, Function.identity()));

    private final char marker;
    private final String description;

    DefLineType(char marker, String description) {
        this.marker = marker;
        this.description = description;
    }

    public char marker() {
        return marker;
    }

    public String description() {
        return description;
    }

    public static Optional<DefLineType> fromMarker(char marker) {
        return Optional.ofNullable(BY_MARKER.get(marker));
    }
}
