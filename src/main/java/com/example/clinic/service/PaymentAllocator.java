package com.example.clinic.service;

import com.example.clinic.domain.Invoice;
import com.example.clinic.domain.Payment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;

/**
 * Spreads a patient's unattributed payments over their outstanding invoices, oldest invoice
 * first, never putting more on an invoice than it still owes after its own tagged payments.
 * The whole ledger up to the as-of date is used, so a monthly statement sees the same
 * placement as the all-outstanding one.
 */
@Component
public class PaymentAllocator {

    /**
     * Result of allocating every unattributed payment in a snapshot.
     *
     * @param applicationsByInvoice shares per invoice id, in payment order
     * @param unappliedByPatient money left once all of a patient's invoices were cleared
     */
    public record Allocation(
        Map<Long, List<PaymentApplication>> applicationsByInvoice,
        Map<Long, BigDecimal> unappliedByPatient
    ) {
        public List<PaymentApplication> applicationsFor(Long invoiceId) {
            return applicationsByInvoice.getOrDefault(invoiceId, List.of());
        }

        public BigDecimal unappliedFor(Long patientId) {
            return unappliedByPatient.getOrDefault(patientId, Amounts.ZERO);
        }
    }

    /**
     * Allocates every unattributed payment of the patients in scope. Invoices outside the scope
     * take their share first when they are older, but only shares on in-scope invoices are kept.
     */
    public Allocation allocate(LedgerSnapshot snapshot) {
        Map<Long, List<PaymentApplication>> applications = new HashMap<>();
        Map<Long, BigDecimal> unapplied = new HashMap<>();

        for (Long patientId : snapshot.patientIds()) {
            List<Payment> payments = snapshot.unattributedPaymentsOf(patientId);
            if (payments.isEmpty()) {
                continue;
            }

            Map<Long, BigDecimal> remaining = new LinkedHashMap<>();
            for (Invoice invoice : snapshot.ledgerOf(patientId)) {
                BigDecimal tagged = sumAmounts(snapshot.paymentsTaggedTo(invoice.getId()));
                remaining.put(invoice.getId(),
                    Amounts.floorAtZero(Amounts.of(invoice.getPatientPortion()).subtract(tagged)));
            }

            BigDecimal leftover = Amounts.ZERO;
            for (Payment payment : payments) {
                BigDecimal available = Amounts.of(payment.getAmount());
                for (Map.Entry<Long, BigDecimal> owed : remaining.entrySet()) {
                    if (!Amounts.isPositive(available)) {
                        break;
                    }
                    if (!Amounts.isPositive(owed.getValue())) {
                        continue;
                    }
                    BigDecimal share = available.min(owed.getValue());
                    owed.setValue(owed.getValue().subtract(share));
                    available = available.subtract(share);
                    if (!snapshot.isInScope(owed.getKey())) {
                        continue;
                    }
                    applications.computeIfAbsent(owed.getKey(), k -> new ArrayList<>())
                        .add(new PaymentApplication(payment.getId(), owed.getKey(),
                            payment.getPaymentDate(), payment.getMethod(),
                            Amounts.of(payment.getAmount()), share, false));
                }
                leftover = leftover.add(available);
            }
            if (Amounts.isPositive(leftover)) {
                unapplied.put(patientId, leftover);
            }
        }

        Map<Long, List<PaymentApplication>> frozen = new HashMap<>();
        applications.forEach((invoiceId, list) -> frozen.put(invoiceId, List.copyOf(list)));
        return new Allocation(Collections.unmodifiableMap(frozen), Collections.unmodifiableMap(unapplied));
    }

    private static BigDecimal sumAmounts(List<Payment> payments) {
        BigDecimal total = Amounts.ZERO;
        for (Payment payment : payments) {
            total = total.add(Amounts.of(payment.getAmount()));
        }
        return total;
    }
}
