package com.example.clinic.service;

import com.example.clinic.domain.Invoice;
import com.example.clinic.domain.Patient;
import com.example.clinic.repository.InvoiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service for generating patient billing statements.
 * Supports the monthly paid/unpaid statement, a single patient's statement and the
 * physician statement for one invoice. Each call reads a fresh snapshot and recomputes.
 */
@Service
@Transactional(readOnly = true)
public class StatementService {

    private static final Logger log = LoggerFactory.getLogger(StatementService.class);

    private final LedgerReader ledgerReader;
    private final BalanceCalculator balanceCalculator;
    private final PatientAggregator patientAggregator;
    private final StatementClassifier classifier;
    private final StatementAssembler assembler;
    private final InvoiceRepository invoiceRepository;
    private final Clock clock;

    public StatementService(LedgerReader ledgerReader,
                            BalanceCalculator balanceCalculator,
                            PatientAggregator patientAggregator,
                            StatementClassifier classifier,
                            StatementAssembler assembler,
                            InvoiceRepository invoiceRepository,
                            Clock clock) {
        this.ledgerReader = ledgerReader;
        this.balanceCalculator = balanceCalculator;
        this.patientAggregator = patientAggregator;
        this.classifier = classifier;
        this.assembler = assembler;
        this.invoiceRepository = invoiceRepository;
        this.clock = clock;
    }

    /**
     * Generates the statement for a scope as of today.
     */
    public Statement generateStatement(StatementScope scope) {
        return generateStatement(scope, today());
    }

    /**
     * Generates the statement for a scope as of a given date.
     * The same ledger and as-of date always give an equal statement.
     *
     * @param scope month or all-outstanding
     * @param asOfDate date balances are aged against
     * @return the statement, with empty sections if nothing was billed in scope
     */
    public Statement generateStatement(StatementScope scope, LocalDate asOfDate) {
        LedgerSnapshot snapshot = ledgerReader.read(scope, asOfDate);
        BalanceCalculator.LedgerBalances balances = balanceCalculator.calculate(snapshot);
        List<PatientSummary> summaries = patientAggregator.aggregate(snapshot, balances);
        StatementClassifier.ClassifiedSummaries classified = classifier.classify(summaries);
        Statement statement = assembler.assemble(scope, asOfDate, classified);

        log.info("Generated statement {} as of {}: {} paid, {} unpaid patients, balance {}, {} warnings",
            statement.generatedScope(), asOfDate,
            statement.paid().patients().size(), statement.unpaid().patients().size(),
            statement.grandTotals().balance(), statement.warnings().size());
        return statement;
    }

    /**
     * Generates one patient's statement for a scope as of today.
     */
    public PatientSummary generatePatientStatement(StatementScope scope, Long patientId) {
        return generatePatientStatement(scope, patientId, today());
    }

    /**
     * Generates one patient's statement for a scope.
     *
     * @throws IllegalArgumentException if the patient is not on the statement for the scope
     */
    public PatientSummary generatePatientStatement(StatementScope scope, Long patientId, LocalDate asOfDate) {
        if (patientId == null) {
            throw new IllegalArgumentException("Patient id is required");
        }
        Statement statement = generateStatement(scope, asOfDate);
        return findPatient(statement.unpaid(), patientId)
            .or(() -> findPatient(statement.paid(), patientId))
            .orElseThrow(() -> new IllegalArgumentException(
                "Patient " + patientId + " is not on the " + scope.label() + " statement"));
    }

    /**
     * Generates the physician statement for one invoice as of today.
     */
    public InvoiceStatement generateInvoiceStatement(Long invoiceId) {
        return generateInvoiceStatement(invoiceId, today());
    }

    /**
     * Generates the physician statement for one invoice. The invoice is evaluated together with
     * the patient's other invoices so unattributed payments land where the all-outstanding
     * statement puts them.
     *
     * @throws IllegalArgumentException if the invoice does not exist or is dated after asOfDate
     */
    public InvoiceStatement generateInvoiceStatement(Long invoiceId, LocalDate asOfDate) {
        if (invoiceId == null) {
            throw new IllegalArgumentException("Invoice id is required");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date is required");
        }

        Invoice invoice = findInvoice(invoiceId)
            .orElseThrow(() -> new IllegalArgumentException("Invoice not found: " + invoiceId));
        if (invoice.getInvoiceDate().isAfter(asOfDate)) {
            throw new IllegalArgumentException("Invoice " + invoiceId + " is dated after " + asOfDate);
        }

        LedgerSnapshot snapshot = ledgerReader.readForPatient(invoice.getPatientId(), asOfDate);
        BalanceCalculator.LedgerBalances balances = balanceCalculator.calculate(snapshot);
        InvoiceResult result = balances.invoices().stream()
            .filter(r -> r.invoiceId().equals(invoiceId))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "Invoice " + invoiceId + " missing from its patient's ledger"));

        Optional<Patient> patient = snapshot.patient(invoice.getPatientId());
        PatientSummary summary = patientAggregator.summarize(invoice.getPatientId(), patient,
            balances.invoices(), balances.allocation().unappliedFor(invoice.getPatientId()));

        List<StatementWarning> warnings = new ArrayList<>(summary.warnings());
        warnings.addAll(result.warnings());

        log.info("Generated physician statement for invoice {} as of {}: balance due {}",
            invoiceId, asOfDate, result.balanceDue());
        return new InvoiceStatement(
            asOfDate,
            invoice.getPatientId(),
            summary.patientName(),
            patient.map(Patient::getInsuranceNumber).orElse(null),
            result,
            List.copyOf(warnings));
    }

    private Optional<Invoice> findInvoice(Long invoiceId) {
        try {
            return invoiceRepository.findById(invoiceId);
        } catch (DataAccessException e) {
            log.error("Failed to read invoice {}", invoiceId, e);
            throw new LedgerReadException("Failed to read invoice " + invoiceId, e);
        }
    }

    private static Optional<PatientSummary> findPatient(Statement.Section section, Long patientId) {
        return section.patients().stream()
            .filter(p -> p.patientId().equals(patientId))
            .findFirst();
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
