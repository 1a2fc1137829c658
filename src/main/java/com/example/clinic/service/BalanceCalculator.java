package com.example.clinic.service;

import com.example.clinic.domain.Invoice;
import com.example.clinic.domain.InvoiceLine;
import com.example.clinic.domain.Payment;
import com.example.clinic.service.InvoiceResult.LineCharge;
import com.example.clinic.service.StatementWarning.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives charges, payments applied, balance due and aging for each invoice.
 * Pure arithmetic over a snapshot: no I/O and no clock, the as-of date comes in with the snapshot.
 */
@Service
public class BalanceCalculator {

    private static final Logger log = LoggerFactory.getLogger(BalanceCalculator.class);

    private final PaymentAllocator paymentAllocator;

    // Gross charge may differ from the insurance + patient split by this much before it is flagged
    @Value("${clinic.billing.reconciliation-tolerance:0.01}")
    private BigDecimal reconciliationTolerance = new BigDecimal("0.01");

    public BalanceCalculator(PaymentAllocator paymentAllocator) {
        this.paymentAllocator = paymentAllocator;
    }

    /**
     * Invoice results for a whole snapshot plus any unattributed money left over per patient.
     */
    public record LedgerBalances(
        List<InvoiceResult> invoices,
        PaymentAllocator.Allocation allocation
    ) {}

    public LedgerBalances calculate(LedgerSnapshot snapshot) {
        PaymentAllocator.Allocation allocation = paymentAllocator.allocate(snapshot);

        List<InvoiceResult> results = new ArrayList<>(snapshot.invoices().size());
        for (Invoice invoice : snapshot.invoices()) {
            results.add(computeInvoiceBalance(invoice,
                snapshot.linesFor(invoice.getId()),
                snapshot.paymentsTaggedTo(invoice.getId()),
                allocation.applicationsFor(invoice.getId()),
                snapshot.asOfDate()));
        }
        return new LedgerBalances(List.copyOf(results), allocation);
    }

    /**
     * Computes one invoice's position.
     *
     * @param taggedPayments payments recorded against this invoice
     * @param allocatedShares shares of unattributed payments already allocated to it
     */
    public InvoiceResult computeInvoiceBalance(Invoice invoice, List<InvoiceLine> lines,
                                               List<Payment> taggedPayments,
                                               List<PaymentApplication> allocatedShares,
                                               LocalDate asOfDate) {
        if (invoice == null) {
            throw new IllegalArgumentException("Invoice cannot be null");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date is required");
        }

        List<StatementWarning> warnings = new ArrayList<>();

        // Charges
        List<LineCharge> charges = new ArrayList<>(lines.size());
        BigDecimal gross = Amounts.ZERO;
        for (InvoiceLine line : lines) {
            BigDecimal lineTotal = line.getLineTotal();
            charges.add(new LineCharge(line.getDescription(), line.getQty(),
                Amounts.of(line.getUnitPrice()), lineTotal));
            gross = gross.add(lineTotal);
        }

        BigDecimal patientPortion = Amounts.of(invoice.getPatientPortion());
        BigDecimal insurancePortion = Amounts.of(invoice.getInsurancePortion());
        BigDecimal split = patientPortion.add(insurancePortion);
        if (gross.subtract(split).abs().compareTo(reconciliationTolerance) > 0) {
            log.warn("Invoice {} lines total {} but split is {} (patient {} + insurance {})",
                invoice.getId(), gross, split, patientPortion, insurancePortion);
            warnings.add(StatementWarning.forInvoice(WarningType.INCONSISTENT_SPLIT,
                invoice.getPatientId(), invoice.getId(),
                "Line items total " + gross.toPlainString() + " but insurance + patient portions total "
                    + split.toPlainString()));
        }

        // Payments: tagged first, capped at the patient portion, then allocated shares
        List<PaymentApplication> applications = new ArrayList<>();
        BigDecimal applied = Amounts.ZERO;
        BigDecimal overpaid = Amounts.ZERO;
        for (Payment payment : taggedPayments) {
            BigDecimal amount = Amounts.of(payment.getAmount());
            BigDecimal room = Amounts.floorAtZero(patientPortion.subtract(applied));
            BigDecimal share = amount.min(room);
            applied = applied.add(share);
            overpaid = overpaid.add(amount.subtract(share));
            applications.add(new PaymentApplication(payment.getId(), invoice.getId(),
                payment.getPaymentDate(), payment.getMethod(), amount, share, true));
        }
        if (Amounts.isPositive(overpaid)) {
            warnings.add(StatementWarning.forInvoice(WarningType.OVERPAYMENT,
                invoice.getPatientId(), invoice.getId(),
                "Payments exceed the patient portion by " + overpaid.toPlainString()));
        }
        for (PaymentApplication share : allocatedShares) {
            BigDecimal room = Amounts.floorAtZero(patientPortion.subtract(applied));
            BigDecimal amount = share.appliedAmount().min(room);
            applied = applied.add(amount);
            applications.add(new PaymentApplication(share.paymentId(), invoice.getId(),
                share.paymentDate(), share.method(), share.amount(), amount, false));
        }

        BigDecimal balanceDue = Amounts.floorAtZero(patientPortion.subtract(applied));

        // Aging
        long daysOutstanding = 0;
        AgingBucket bucket = AgingBucket.NOT_APPLICABLE;
        if (Amounts.isPositive(balanceDue)) {
            daysOutstanding = Math.max(0, ChronoUnit.DAYS.between(invoice.getInvoiceDate(), asOfDate));
            bucket = AgingBucket.forDaysOutstanding(daysOutstanding);
        }

        checkStoredStatus(invoice, balanceDue, warnings);

        return new InvoiceResult(
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getPatientId(),
            invoice.getVisitId(),
            invoice.getInvoiceDate(),
            invoice.getStatus(),
            List.copyOf(charges),
            gross,
            insurancePortion,
            patientPortion,
            List.copyOf(applications),
            applied,
            overpaid,
            balanceDue,
            daysOutstanding,
            bucket,
            List.copyOf(warnings)
        );
    }

    private void checkStoredStatus(Invoice invoice, BigDecimal balanceDue, List<StatementWarning> warnings) {
        if (invoice.getStatus() == null) {
            return;
        }
        boolean settled = !Amounts.isPositive(balanceDue);
        if (invoice.isMarkedPaid() && !settled) {
            warnings.add(StatementWarning.forInvoice(WarningType.STATUS_MISMATCH,
                invoice.getPatientId(), invoice.getId(),
                "Invoice is marked PAID but " + balanceDue.toPlainString() + " is still due"));
        } else if (!invoice.isMarkedPaid() && settled) {
            warnings.add(StatementWarning.forInvoice(WarningType.STATUS_MISMATCH,
                invoice.getPatientId(), invoice.getId(),
                "Invoice is marked " + invoice.getStatus() + " but nothing is due"));
        }
    }
}
