package com.example.clinic.service;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The window a statement covers: one calendar month of invoice dates, or every invoice
 * billed up to the as-of date.
 */
public record StatementScope(Kind kind, YearMonth month) {

    public static final String ALL_OUTSTANDING_LABEL = "all-outstanding";

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 9999;

    private static final Pattern ISO_MONTH = Pattern.compile("^(\\d{4})-(\\d{1,2})$");
    private static final Pattern REPORT_MONTH = Pattern.compile("^(\\d{1,2})/(\\d{4})$");

    public enum Kind {
        MONTH,
        ALL_OUTSTANDING
    }

    public StatementScope {
        if (kind == null) {
            throw new InvalidStatementScopeException("Statement scope kind is required");
        }
        if (kind == Kind.MONTH && month == null) {
            throw new InvalidStatementScopeException("Monthly statement scope needs a month");
        }
        if (kind == Kind.ALL_OUTSTANDING && month != null) {
            throw new InvalidStatementScopeException("All-outstanding scope cannot carry a month");
        }
    }

    /**
     * Scope for a calendar month.
     *
     * @throws InvalidStatementScopeException if month is outside 1-12 or the year is implausible
     */
    public static StatementScope ofMonth(int year, int month) {
        if (month < 1 || month > 12) {
            throw new InvalidStatementScopeException("Month must be between 1 and 12: " + month);
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new InvalidStatementScopeException(
                "Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ": " + year);
        }
        return new StatementScope(Kind.MONTH, YearMonth.of(year, month));
    }

    public static StatementScope allOutstanding() {
        return new StatementScope(Kind.ALL_OUTSTANDING, null);
    }

    /**
     * Parses "2025-11", "11/2025" or "all-outstanding".
     */
    public static StatementScope parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidStatementScopeException("Statement scope is required");
        }
        String value = text.trim();
        if (ALL_OUTSTANDING_LABEL.equalsIgnoreCase(value) || "all".equalsIgnoreCase(value)) {
            return allOutstanding();
        }
        Matcher iso = ISO_MONTH.matcher(value);
        if (iso.matches()) {
            return ofMonth(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)));
        }
        Matcher report = REPORT_MONTH.matcher(value);
        if (report.matches()) {
            return ofMonth(Integer.parseInt(report.group(2)), Integer.parseInt(report.group(1)));
        }
        throw new InvalidStatementScopeException("Unrecognised statement scope: " + value);
    }

    @JsonIgnore
    public boolean isMonth() {
        return kind == Kind.MONTH;
    }

    /**
     * First invoice date in scope, or null when the scope is open-ended.
     */
    public LocalDate startDate() {
        return isMonth() ? month.atDay(1) : null;
    }

    /**
     * Last invoice date in scope. All-outstanding statements stop at the as-of date.
     */
    public LocalDate endDate(LocalDate asOfDate) {
        return isMonth() ? month.atEndOfMonth() : asOfDate;
    }

    /** "2025-11" or "all-outstanding". */
    public String label() {
        return isMonth() ? month.toString() : ALL_OUTSTANDING_LABEL;
    }

    @Override
    public String toString() {
        return label();
    }
}
