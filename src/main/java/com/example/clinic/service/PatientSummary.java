package com.example.clinic.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * One patient's position within a statement, with the invoices, services and payments behind it.
 *
 * @param patientName display name, or the raw id when the patient record is missing
 * @param balance totalInvoiced minus paymentsReceived, never negative
 * @param unappliedCredit unattributed payments that found no outstanding invoice in scope
 * @param maxAgingDays oldest days outstanding among invoices still owing, 0 if none
 * @param warnings patient-level warnings only; see {@link #allWarnings()}
 */
public record PatientSummary(
    Long patientId,
    String patientName,
    boolean patientFound,
    BigDecimal totalInvoiced,
    BigDecimal paymentsReceived,
    BigDecimal balance,
    BigDecimal unappliedCredit,
    long maxAgingDays,
    AccountStatus accountStatus,
    AgingSummary aging,
    List<InvoiceResult> invoices,
    List<BilledService> services,
    List<PaymentApplication> payments,
    List<StatementWarning> warnings
) {

    public enum AccountStatus {
        PAID,
        PARTIAL,
        UNPAID
    }

    /**
     * A service aggregated over all of the patient's invoices by description.
     */
    public record BilledService(String description, int qty, BigDecimal amount) {}

    public boolean hasOutstandingInvoice() {
        return invoices.stream().anyMatch(InvoiceResult::isOutstanding);
    }

    /** Patient-level warnings followed by each invoice's warnings. */
    public List<StatementWarning> allWarnings() {
        List<StatementWarning> all = new ArrayList<>(warnings);
        for (InvoiceResult invoice : invoices) {
            all.addAll(invoice.warnings());
        }
        return all;
    }
}
