package com.flagship.general_ledger.period;

import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Length of an accounting period. Fiscal years follow the calendar year.
 */
public enum PeriodType {
    MONTHLY(12),
    QUARTERLY(4),
    ANNUAL(1);

    private final int periodsPerYear;

    PeriodType(int periodsPerYear) {
        this.periodsPerYear = periodsPerYear;
    }

    public int getPeriodsPerYear() {
        return periodsPerYear;
    }

    /** {@code 2024-01}, {@code 2024-Q1} or {@code 2024}. */
    public String periodId(int fiscalYear, int periodNumber) {
        return switch (this) {
            case MONTHLY -> String.format("%d-%02d", fiscalYear, periodNumber);
            case QUARTERLY -> fiscalYear + "-Q" + periodNumber;
            case ANNUAL -> String.valueOf(fiscalYear);
        };
    }

    /** {@code January 2024}, {@code Q1 2024} or {@code FY 2024}. */
    public String periodName(int fiscalYear, int periodNumber) {
        return switch (this) {
            case MONTHLY -> Month.of(periodNumber).getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + fiscalYear;
            case QUARTERLY -> "Q" + periodNumber + " " + fiscalYear;
            case ANNUAL -> "FY " + fiscalYear;
        };
    }

    public LocalDate startDate(int fiscalYear, int periodNumber) {
        int monthsPerPeriod = 12 / periodsPerYear;
        return LocalDate.of(fiscalYear, (periodNumber - 1) * monthsPerPeriod + 1, 1);
    }

    public LocalDate endDate(int fiscalYear, int periodNumber) {
        int monthsPerPeriod = 12 / periodsPerYear;
        return startDate(fiscalYear, periodNumber).plusMonths(monthsPerPeriod).minusDays(1);
    }
}
