package com.example.clinic.service;

import com.example.clinic.domain.Invoice.InvoiceStatus;
import com.example.clinic.service.StatementWarning.WarningType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Computed billing position of one invoice as of a date.
 *
 * @param storedStatus status as recorded by the front desk, never used for classification
 * @param grossCharge sum of qty x unit price over the lines
 * @param totalPaid payments applied to this invoice, capped at the patient portion
 * @param overpaid tagged payments beyond the patient portion
 * @param balanceDue patient portion minus total paid, never negative
 * @param daysOutstanding whole days since the invoice date, 0 once settled
 */
public record InvoiceResult(
    Long invoiceId,
    String invoiceNumber,
    Long patientId,
    Long visitId,
    LocalDate invoiceDate,
    InvoiceStatus storedStatus,
    List<LineCharge> lines,
    BigDecimal grossCharge,
    BigDecimal insurancePortion,
    BigDecimal patientPortion,
    List<PaymentApplication> payments,
    BigDecimal totalPaid,
    BigDecimal overpaid,
    BigDecimal balanceDue,
    long daysOutstanding,
    AgingBucket agingBucket,
    List<StatementWarning> warnings
) {

    /**
     * One priced service line as billed.
     */
    public record LineCharge(
        String description,
        int qty,
        BigDecimal unitPrice,
        BigDecimal lineTotal
    ) {}

    public boolean isOutstanding() {
        return Amounts.isPositive(balanceDue);
    }

    /** True when the lines do not reconcile with the insurance/patient split. */
    public boolean isInconsistent() {
        return warnings.stream().anyMatch(w -> w.type() == WarningType.INCONSISTENT_SPLIT);
    }
}
