package com.example.clinic.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.List;

/**
 * A computed patient billing statement. Never stored: every request recomputes it from the ledger.
 *
 * @param generatedScope "2025-11" or "all-outstanding"
 * @param periodStart first invoice date covered, null for all-outstanding
 * @param periodEnd last invoice date covered
 */
public record Statement(
    String generatedScope,
    StatementScope scope,
    LocalDate asOfDate,
    LocalDate periodStart,
    LocalDate periodEnd,
    Section paid,
    Section unpaid,
    SectionTotals grandTotals,
    List<StatementWarning> warnings
) {

    public enum SectionType {
        PAID("paid"),
        UNPAID("unpaid");

        private final String label;

        SectionType(String label) {
            this.label = label;
        }

        @JsonValue
        public String getLabel() {
            return label;
        }
    }

    public record Section(SectionType type, List<PatientSummary> patients, SectionTotals totals) {

        @JsonIgnore
        public boolean isEmpty() {
            return patients.isEmpty();
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return paid.isEmpty() && unpaid.isEmpty();
    }
}
