package com.example.clinic.service;

import java.math.BigDecimal;

/**
 * Sum of the member patients' totals for one statement section (or both together).
 */
public record SectionTotals(
    int patientCount,
    int invoiceCount,
    BigDecimal totalInvoiced,
    BigDecimal paymentsReceived,
    BigDecimal balance,
    AgingSummary aging
) {

    public static final SectionTotals EMPTY =
        new SectionTotals(0, 0, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, AgingSummary.EMPTY);

    public SectionTotals add(PatientSummary patient) {
        return new SectionTotals(
            patientCount + 1,
            invoiceCount + patient.invoices().size(),
            totalInvoiced.add(patient.totalInvoiced()),
            paymentsReceived.add(patient.paymentsReceived()),
            balance.add(patient.balance()),
            aging.add(patient.aging()));
    }

    public SectionTotals add(SectionTotals other) {
        return new SectionTotals(
            patientCount + other.patientCount,
            invoiceCount + other.invoiceCount,
            totalInvoiced.add(other.totalInvoiced),
            paymentsReceived.add(other.paymentsReceived),
            balance.add(other.balance),
            aging.add(other.aging));
    }
}
