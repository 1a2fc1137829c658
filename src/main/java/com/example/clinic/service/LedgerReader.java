package com.example.clinic.service;

import com.example.clinic.domain.Invoice;
import com.example.clinic.domain.Patient;
import com.example.clinic.domain.Payment;
import com.example.clinic.repository.InvoiceRepository;
import com.example.clinic.repository.PatientRepository;
import com.example.clinic.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Loads the invoices, line items, payments and patients a statement needs, in one read-only
 * transaction. Invoices are read first, then their payments and patients; a payment recorded
 * after the invoices were read may be missed and will show up on the next statement.
 * A monthly read also loads the same patients' invoices from other months, without lines, so
 * unattributed payments can be placed against the whole ledger.
 */
@Service
@Transactional(readOnly = true)
public class LedgerReader {

    private static final Logger log = LoggerFactory.getLogger(LedgerReader.class);

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final PatientRepository patientRepository;

    public LedgerReader(InvoiceRepository invoiceRepository,
                        PaymentRepository paymentRepository,
                        PatientRepository patientRepository) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.patientRepository = patientRepository;
    }

    /**
     * Reads the ledger for a scope.
     *
     * @param scope month or all-outstanding
     * @param asOfDate payments after this date are left out
     * @return the indexed snapshot, empty when nothing was billed in scope
     * @throws LedgerReadException if the store cannot be read
     */
    public LedgerSnapshot read(StatementScope scope, LocalDate asOfDate) {
        if (scope == null) {
            throw new InvalidStatementScopeException("Statement scope is required");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date is required");
        }

        try {
            if (!scope.isMonth()) {
                return load(scope, asOfDate, invoiceRepository.findWithLinesUpTo(asOfDate), false);
            }
            List<Invoice> invoices =
                invoiceRepository.findWithLinesByDateRange(scope.startDate(), scope.endDate(asOfDate));
            return load(scope, asOfDate, invoices, true);
        } catch (DataAccessException e) {
            log.error("Failed to read billing ledger for scope {}", scope.label(), e);
            throw new LedgerReadException("Failed to read billing ledger for scope " + scope.label(), e);
        }
    }

    /**
     * Reads every invoice of one patient billed up to the as-of date, with that patient's payments.
     */
    public LedgerSnapshot readForPatient(Long patientId, LocalDate asOfDate) {
        if (patientId == null) {
            throw new IllegalArgumentException("Patient id is required");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date is required");
        }

        StatementScope scope = StatementScope.allOutstanding();
        try {
            List<Invoice> invoices = invoiceRepository.findWithLinesByPatientUpTo(patientId, asOfDate);
            return load(scope, asOfDate, invoices, false);
        } catch (DataAccessException e) {
            log.error("Failed to read billing ledger for patient {}", patientId, e);
            throw new LedgerReadException("Failed to read billing ledger for patient " + patientId, e);
        }
    }

    private LedgerSnapshot load(StatementScope scope, LocalDate asOfDate, List<Invoice> invoices,
                                boolean withOtherInvoices) {
        if (invoices.isEmpty()) {
            log.debug("No invoices in scope {}", scope.label());
            return LedgerSnapshot.empty(scope, asOfDate);
        }

        Set<Long> invoiceIds = new TreeSet<>();
        Set<Long> patientIds = new TreeSet<>();
        for (Invoice invoice : invoices) {
            invoiceIds.add(invoice.getId());
            patientIds.add(invoice.getPatientId());
        }

        List<Invoice> otherInvoices = new ArrayList<>();
        if (withOtherInvoices) {
            for (Invoice invoice : invoiceRepository.findByPatientsUpTo(patientIds, asOfDate)) {
                if (!invoiceIds.contains(invoice.getId())) {
                    otherInvoices.add(invoice);
                }
            }
        }
        Set<Long> paymentInvoiceIds = new TreeSet<>(invoiceIds);
        for (Invoice invoice : otherInvoices) {
            paymentInvoiceIds.add(invoice.getId());
        }

        List<Payment> payments =
            paymentRepository.findForInvoicesOrPatients(paymentInvoiceIds, patientIds, asOfDate);
        List<Patient> patients = patientRepository.findByIdIn(patientIds);

        LedgerSnapshot snapshot =
            LedgerSnapshot.index(scope, asOfDate, invoices, otherInvoices, payments, patients);
        log.debug("Read {} invoices ({} outside scope), {} payments, {} of {} patients for scope {}",
            invoices.size(), otherInvoices.size(), snapshot.paymentCount(), patients.size(),
            patientIds.size(), scope.label());
        return snapshot;
    }
}
