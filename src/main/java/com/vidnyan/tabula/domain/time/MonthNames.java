package com.vidnyan.tabula.domain.time;

import java.time.Month;
import java.util.List;

/**
 * Month labels used in tabulation headings.
 */
public final class MonthNames {

    private static final List<String> PT_SHORT = List.of(
            "jan", "fev", "mar", "abr", "mai", "jun", "jul", "ago", "set", "out", "nov", "dez");
    private static final List<String> PT_FULL = List.of(
            "janeiro", "fevereiro", "março", "abril", "maio", "junho",
            "julho", "agosto", "setembro", "outubro", "novembro", "dezembro");
    private static final List<String> EN_SHORT = List.of(
            "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec");
    private static final List<String> EN_FULL = List.of(
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December");

    private MonthNames() {
    }

    public static String ptShort(Month month) {
        return PT_SHORT.get(month.ordinal());
    }

    public static String ptFull(Month month) {
        return PT_FULL.get(month.ordinal());
    }

    public static String enShort(Month month) {
        return EN_SHORT.get(month.ordinal());
    }

    public static String enFull(Month month) {
        return EN_FULL.get(month.ordinal());
    }

    /**
     * Month number padded to two digits, e.g. "09".
     */
    public static String twoDigits(Month month) {
        return String.format("%02d", month.getValue());
    }
}
