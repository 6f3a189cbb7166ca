package com.kreasipositif.wpsprocessor.domain;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Calendar month a WPS batch pays salaries for.
 *
 * @param month 1-12
 * @param year  four-digit year
 */
public record SalaryPeriod(int month, int year) {

    /** Day of the following month by which the salary file must reach the bank. */
    public static final int SUBMISSION_DEADLINE_DAY = 15;

    public SalaryPeriod {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12, got " + month);
        }
        if (year < 1000 || year > 9999) {
            throw new IllegalArgumentException("year must have four digits, got " + year);
        }
    }

    public static SalaryPeriod of(LocalDate date) {
        return new SalaryPeriod(date.getMonthValue(), date.getYear());
    }

    public YearMonth toYearMonth() {
        return YearMonth.of(year, month);
    }

    public LocalDate firstDay() {
        return toYearMonth().atDay(1);
    }

    public LocalDate lastDay() {
        return toYearMonth().atEndOfMonth();
    }

    /** The 15th of the month after this period. */
    public LocalDate submissionDeadline() {
        return toYearMonth().plusMonths(1).atDay(SUBMISSION_DEADLINE_DAY);
    }

    /** {@code MM} as written in the EDR. */
    public String monthCode() {
        return "%02d".formatted(month);
    }

    @Override
    public String toString() {
        return "%04d-%02d".formatted(year, month);
    }
}
