package com.example.clinic.service;

import com.example.clinic.domain.Invoice;
import com.example.clinic.domain.InvoiceLine;
import com.example.clinic.domain.Patient;
import com.example.clinic.domain.Payment;

import java.time.LocalDate;
import java.util.*;

/**
 * Everything one statement is computed from, indexed once by invoice and patient id so the
 * calculators never scan the full ledger.
 * Payments tagged to an invoice outside the snapshot, or dated after the as-of date, are not
 * indexed at all.
 *
 * @param invoices invoices in scope, oldest first
 * @param otherInvoices the same patients' invoices outside the scope, billed up to the as-of
 *     date; they only absorb unattributed payments and never appear on the statement
 */
public record LedgerSnapshot(
    StatementScope scope,
    LocalDate asOfDate,
    List<Invoice> invoices,
    List<Invoice> otherInvoices,
    Map<Long, List<InvoiceLine>> linesByInvoice,
    Map<Long, List<Payment>> paymentsByInvoice,
    Map<Long, List<Payment>> unattributedByPatient,
    Map<Long, Patient> patientsById
) {

    private static final Comparator<Invoice> OLDEST_FIRST =
        Comparator.comparing(Invoice::getInvoiceDate).thenComparing(Invoice::getId);

    private static final Comparator<Payment> BY_PAYMENT_DATE =
        Comparator.comparing(Payment::getPaymentDate).thenComparing(Payment::getId,
            Comparator.nullsLast(Comparator.naturalOrder()));

    public static LedgerSnapshot empty(StatementScope scope, LocalDate asOfDate) {
        return new LedgerSnapshot(scope, asOfDate, List.of(), List.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    /**
     * Builds the invoice and patient indexes for a scope that covers the patients' whole ledger.
     */
    public static LedgerSnapshot index(StatementScope scope, LocalDate asOfDate,
                                       Collection<Invoice> invoices,
                                       Collection<Payment> payments,
                                       Collection<Patient> patients) {
        return index(scope, asOfDate, invoices, List.of(), payments, patients);
    }

    /**
     * Builds the invoice and patient indexes.
     *
     * @param otherInvoices invoices of the same patients outside the scope; any that are also in
     *     {@code invoices}, or belong to a patient with nothing in scope, are ignored
     */
    public static LedgerSnapshot index(StatementScope scope, LocalDate asOfDate,
                                       Collection<Invoice> invoices,
                                       Collection<Invoice> otherInvoices,
                                       Collection<Payment> payments,
                                       Collection<Patient> patients) {
        List<Invoice> sortedInvoices = new ArrayList<>(invoices);
        sortedInvoices.sort(OLDEST_FIRST);

        Map<Long, List<InvoiceLine>> linesByInvoice = new LinkedHashMap<>();
        Set<Long> patientIds = new HashSet<>();
        for (Invoice invoice : sortedInvoices) {
            List<InvoiceLine> lines = new ArrayList<>(invoice.getLines());
            lines.sort(Comparator.comparingInt(InvoiceLine::getLineIndex));
            linesByInvoice.put(invoice.getId(), List.copyOf(lines));
            patientIds.add(invoice.getPatientId());
        }

        List<Invoice> sortedOthers = new ArrayList<>();
        Set<Long> otherIds = new HashSet<>();
        for (Invoice invoice : otherInvoices) {
            if (!linesByInvoice.containsKey(invoice.getId())
                && patientIds.contains(invoice.getPatientId())
                && !invoice.getInvoiceDate().isAfter(asOfDate)
                && otherIds.add(invoice.getId())) {
                sortedOthers.add(invoice);
            }
        }
        sortedOthers.sort(OLDEST_FIRST);

        List<Payment> sortedPayments = new ArrayList<>(payments);
        sortedPayments.sort(BY_PAYMENT_DATE);

        Map<Long, List<Payment>> byInvoice = new HashMap<>();
        Map<Long, List<Payment>> unattributed = new HashMap<>();
        for (Payment payment : sortedPayments) {
            if (payment.getPaymentDate().isAfter(asOfDate)) {
                continue;
            }
            if (payment.isUnattributed()) {
                if (patientIds.contains(payment.getPatientId())) {
                    unattributed.computeIfAbsent(payment.getPatientId(), k -> new ArrayList<>())
                        .add(payment);
                }
            } else if (linesByInvoice.containsKey(payment.getInvoiceId())
                || otherIds.contains(payment.getInvoiceId())) {
                byInvoice.computeIfAbsent(payment.getInvoiceId(), k -> new ArrayList<>()).add(payment);
            }
        }

        Map<Long, Patient> patientsById = new HashMap<>();
        for (Patient patient : patients) {
            patientsById.put(patient.getId(), patient);
        }

        return new LedgerSnapshot(scope, asOfDate, List.copyOf(sortedInvoices), List.copyOf(sortedOthers),
            Collections.unmodifiableMap(linesByInvoice),
            copyOfLists(byInvoice), copyOfLists(unattributed),
            Collections.unmodifiableMap(patientsById));
    }

    private static Map<Long, List<Payment>> copyOfLists(Map<Long, List<Payment>> source) {
        Map<Long, List<Payment>> copy = new HashMap<>();
        source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return invoices.isEmpty();
    }

    /** Distinct patient ids of the invoices in scope, ascending. */
    public SortedSet<Long> patientIds() {
        SortedSet<Long> ids = new TreeSet<>();
        for (Invoice invoice : invoices) {
            ids.add(invoice.getPatientId());
        }
        return ids;
    }

    /** True for invoices in scope, false for other invoices and unknown ids. */
    public boolean isInScope(Long invoiceId) {
        return linesByInvoice.containsKey(invoiceId);
    }

    /**
     * A patient's invoices in and out of scope, oldest first. This is the order unattributed
     * payments are placed in.
     */
    public List<Invoice> ledgerOf(Long patientId) {
        List<Invoice> ledger = new ArrayList<>();
        for (Invoice invoice : invoices) {
            if (invoice.getPatientId().equals(patientId)) {
                ledger.add(invoice);
            }
        }
        for (Invoice invoice : otherInvoices) {
            if (invoice.getPatientId().equals(patientId)) {
                ledger.add(invoice);
            }
        }
        ledger.sort(OLDEST_FIRST);
        return ledger;
    }

    public List<InvoiceLine> linesFor(Long invoiceId) {
        return linesByInvoice.getOrDefault(invoiceId, List.of());
    }

    public List<Payment> paymentsTaggedTo(Long invoiceId) {
        return paymentsByInvoice.getOrDefault(invoiceId, List.of());
    }

    public List<Payment> unattributedPaymentsOf(Long patientId) {
        return unattributedByPatient.getOrDefault(patientId, List.of());
    }

    public Optional<Patient> patient(Long patientId) {
        return Optional.ofNullable(patientsById.get(patientId));
    }

    /** Payments indexed against invoices in scope, plus unattributed ones. */
    public int paymentCount() {
        int count = 0;
        for (Invoice invoice : invoices) {
            count += paymentsTaggedTo(invoice.getId()).size();
        }
        for (List<Payment> list : unattributedByPatient.values()) {
            count += list.size();
        }
        return count;
    }
}
