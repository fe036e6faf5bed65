package com.vidnyan.tabula.domain.time;

import java.time.DateTimeException;
import java.time.Month;
import java.time.Year;
import java.time.YearMonth;

/**
 * Maps two-digit years, as used in date-coded fields of tabulation data, onto a
 * hundred-year window.
 *
 * <p>With the default cutoff of 39, {@code 00..39} are 2000..2039 and
 * {@code 40..99} are 1940..1999.
 */
public final class TwoDigitYearWindow {

    public static final int DEFAULT_MAX_TWENTY_FIRST_CENTURY_YEAR = 39;

    private final int maxTwentyFirstCenturyYear;

    public TwoDigitYearWindow(int maxTwentyFirstCenturyYear) {
        if (maxTwentyFirstCenturyYear < 0 || maxTwentyFirstCenturyYear > 98) {
            throw new IllegalArgumentException(
                    "Cutoff must be between 0 and 98, got " + maxTwentyFirstCenturyYear);
        }
        this.maxTwentyFirstCenturyYear = maxTwentyFirstCenturyYear;
    }

    public static TwoDigitYearWindow defaultWindow() {
        return new TwoDigitYearWindow(DEFAULT_MAX_TWENTY_FIRST_CENTURY_YEAR);
    }

    public int maxTwentyFirstCenturyYear() {
        return maxTwentyFirstCenturyYear;
    }

    public Year minimumYear() {
        return Year.of(1900 + maxTwentyFirstCenturyYear + 1);
    }

    public Year maximumYear() {
        return Year.of(2000 + maxTwentyFirstCenturyYear);
    }

    public boolean isInWindow(Year year) {
        return !year.isBefore(minimumYear()) && !year.isAfter(maximumYear());
    }

    /**
     * Validate a full year against the window.
     *
     * @throws YearOutOfRangeException if the year has no two-digit form
     */
    public Year requireInWindow(Year year) {
        if (!isInWindow(year)) {
            throw new YearOutOfRangeException(
                    "Year must be between " + minimumYear() + " and " + maximumYear() + ", got " + year);
        }
        return year;
    }

    public Year fromTwoDigits(int twoDigits) {
        if (twoDigits >= 0 && twoDigits <= maxTwentyFirstCenturyYear) {
            return Year.of(2000 + twoDigits);
        }
        if (twoDigits > maxTwentyFirstCenturyYear && twoDigits <= 99) {
            return Year.of(1900 + twoDigits);
        }
        throw new YearOutOfRangeException("Year in 2 digits must be between 00 and 99, got " + twoDigits);
    }

    public Year fromTwoDigits(String twoDigits) {
        try {
            return fromTwoDigits(Integer.parseInt(twoDigits.strip()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a two-digit year: '" + twoDigits + "'", e);
        }
    }

    public int toTwoDigits(Year year) {
        requireInWindow(year);
        return year.getValue() % 100;
    }

    public String toTwoDigitString(Year year) {
        return String.format("%02d", toTwoDigits(year));
    }

    /**
     * Parse an {@code aa} field (two-digit year).
     */
    public Year parseAa(String value) {
        if (value.length() != 2) {
            throw new IllegalArgumentException("aa date must be exactly 2 characters long: '" + value + "'");
        }
        return fromTwoDigits(value);
    }

    /**
     * Parse an {@code aamm} field (two-digit year followed by two-digit month).
     */
    public YearMonth parseAamm(String value) {
        if (value.length() != 4) {
            throw new IllegalArgumentException("aamm date must be exactly 4 characters long: '" + value + "'");
        }
        Year year = fromTwoDigits(value.substring(0, 2));
        String mm = value.substring(2, 4);
        try {
            return year.atMonth(Month.of(Integer.parseInt(mm)));
        } catch (NumberFormatException | DateTimeException e) {
            throw new IllegalArgumentException("Not a month: '" + mm + "'", e);
        }
    }
}
