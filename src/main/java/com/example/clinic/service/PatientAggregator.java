package com.example.clinic.service;

import com.example.clinic.domain.Patient;
import com.example.clinic.service.InvoiceResult.LineCharge;
import com.example.clinic.service.PatientSummary.AccountStatus;
import com.example.clinic.service.PatientSummary.BilledService;
import com.example.clinic.service.StatementWarning.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;

/**
 * Rolls invoice results up to one summary per patient.
 * For a month every patient billed in it gets a summary, including fully paid ones. The
 * all-outstanding view keeps only invoices still owing, and only patients with such an invoice
 * or with unattributed money left over.
 */
@Service
public class PatientAggregator {

    private static final Logger log = LoggerFactory.getLogger(PatientAggregator.class);

    private static final Comparator<InvoiceResult> INVOICE_ORDER =
        Comparator.comparing(InvoiceResult::invoiceDate).thenComparing(InvoiceResult::invoiceId);

    private static final Comparator<PaymentApplication> PAYMENT_ORDER =
        Comparator.comparing(PaymentApplication::paymentDate)
            .thenComparing(PaymentApplication::paymentId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PaymentApplication::invoiceId);

    /**
     * Builds the patient summaries, ordered by patient id.
     */
    public List<PatientSummary> aggregate(LedgerSnapshot snapshot, BalanceCalculator.LedgerBalances balances) {
        boolean outstandingOnly = !snapshot.scope().isMonth();
        Map<Long, List<InvoiceResult>> byPatient = new TreeMap<>();
        for (InvoiceResult invoice : balances.invoices()) {
            if (outstandingOnly && !invoice.isOutstanding()) {
                continue;
            }
            byPatient.computeIfAbsent(invoice.patientId(), k -> new ArrayList<>()).add(invoice);
        }

        List<PatientSummary> summaries = new ArrayList<>(snapshot.patientIds().size());
        for (Long patientId : snapshot.patientIds()) {
            List<InvoiceResult> invoices = byPatient.getOrDefault(patientId, List.of());
            BigDecimal credit = balances.allocation().unappliedFor(patientId);
            if (invoices.isEmpty() && !Amounts.isPositive(credit)) {
                log.debug("Patient {} has nothing outstanding, left off the statement", patientId);
                continue;
            }
            summaries.add(summarize(patientId, snapshot.patient(patientId), invoices, credit));
        }
        return summaries;
    }

    /**
     * Summarises one patient's invoices.
     *
     * @param patient empty when the patient record could not be found
     * @param unappliedCredit unattributed money with nowhere to go, zero if none
     */
    public PatientSummary summarize(Long patientId, Optional<Patient> patient,
                                    List<InvoiceResult> invoiceResults, BigDecimal unappliedCredit) {
        List<InvoiceResult> invoices = new ArrayList<>(invoiceResults);
        invoices.sort(INVOICE_ORDER);

        List<StatementWarning> warnings = new ArrayList<>();
        String name = String.valueOf(patientId);
        if (patient.isPresent()) {
            if (!patient.get().getDisplayName().isBlank()) {
                name = patient.get().getDisplayName();
            }
        } else {
            log.warn("Patient {} referenced by billing records was not found", patientId);
            warnings.add(StatementWarning.forPatient(WarningType.MISSING_PATIENT, patientId,
                "No patient record for id " + patientId));
        }

        BigDecimal totalInvoiced = Amounts.ZERO;
        BigDecimal paymentsReceived = Amounts.ZERO;
        long maxAgingDays = 0;
        AgingSummary aging = AgingSummary.EMPTY;
        Map<String, ServiceTotals> services = new TreeMap<>();
        List<PaymentApplication> payments = new ArrayList<>();

        for (InvoiceResult invoice : invoices) {
            totalInvoiced = totalInvoiced.add(invoice.patientPortion());
            paymentsReceived = paymentsReceived.add(invoice.totalPaid());
            if (invoice.isOutstanding()) {
                maxAgingDays = Math.max(maxAgingDays, invoice.daysOutstanding());
            }
            aging = aging.add(AgingSummary.of(invoice));
            for (LineCharge line : invoice.lines()) {
                String description = line.description() != null ? line.description() : "Unknown";
                services.computeIfAbsent(description, k -> new ServiceTotals()).add(line);
            }
            payments.addAll(invoice.payments());
        }
        payments.sort(PAYMENT_ORDER);

        BigDecimal credit = Amounts.of(unappliedCredit);
        if (Amounts.isPositive(credit)) {
            warnings.add(StatementWarning.forPatient(WarningType.UNAPPLIED_CREDIT, patientId,
                "Unattributed payments of " + credit.toPlainString() + " could not be applied to any invoice"));
        }

        BigDecimal balance = totalInvoiced.subtract(paymentsReceived);

        List<BilledService> billedServices = new ArrayList<>(services.size());
        services.forEach((description, totals) ->
            billedServices.add(new BilledService(description, totals.qty, totals.amount)));

        return new PatientSummary(
            patientId,
            name,
            patient.isPresent(),
            totalInvoiced,
            paymentsReceived,
            balance,
            credit,
            maxAgingDays,
            accountStatus(balance, paymentsReceived),
            aging,
            List.copyOf(invoices),
            List.copyOf(billedServices),
            List.copyOf(payments),
            List.copyOf(warnings)
        );
    }

    private static AccountStatus accountStatus(BigDecimal balance, BigDecimal paymentsReceived) {
        if (!Amounts.isPositive(balance)) {
            return AccountStatus.PAID;
        }
        return Amounts.isPositive(paymentsReceived) ? AccountStatus.PARTIAL : AccountStatus.UNPAID;
    }

    private static final class ServiceTotals {
        private int qty;
        private BigDecimal amount = Amounts.ZERO;

        void add(LineCharge line) {
            qty += line.qty();
            amount = amount.add(line.lineTotal());
        }
    }
}
