package com.example.clinic.service;

import com.example.clinic.domain.Invoice;
import com.example.clinic.domain.Patient;
import com.example.clinic.domain.Payment;
import com.example.clinic.repository.InvoiceRepository;
import com.example.clinic.repository.PatientRepository;
import com.example.clinic.repository.PaymentRepository;
import com.example.clinic.service.PatientSummary.AccountStatus;
import com.example.clinic.service.StatementWarning.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.example.clinic.service.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StatementService.
 * Repositories are mocked; every calculation component is real, so these run the whole
 * read, calculate, aggregate, classify and assemble pipeline.
 */
@ExtendWith(MockitoExtension.class)
class StatementServiceTest {

    @Mock
    private InvoiceRepository invoiceRepository;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private PatientRepository patientRepository;

    private StatementService statementService;

    @BeforeEach
    void setUp() {
        LedgerReader ledgerReader = new LedgerReader(invoiceRepository, paymentRepository, patientRepository);
        BalanceCalculator balanceCalculator = new BalanceCalculator(new PaymentAllocator());
        Clock clock = Clock.fixed(AS_OF.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

        statementService = new StatementService(ledgerReader, balanceCalculator, new PatientAggregator(),
            new StatementClassifier(), new StatementAssembler(), invoiceRepository, clock);
    }

    private void givenLedger(List<Invoice> invoices, List<Payment> payments, List<Patient> patients) {
        when(invoiceRepository.findWithLinesUpTo(AS_OF)).thenReturn(invoices);
        when(paymentRepository.findForInvoicesOrPatients(anyCollection(), anyCollection(), eq(AS_OF)))
            .thenReturn(payments);
        when(patientRepository.findByIdIn(anyCollection())).thenReturn(patients);
    }

    /**
     * Stubs a monthly read: the month's invoices, then every invoice of the same patients up to
     * the as-of date.
     */
    private void givenMonth(StatementScope month, List<Invoice> invoices, List<Invoice> patientsLedger,
                            List<Payment> payments, List<Patient> patients) {
        when(invoiceRepository.findWithLinesByDateRange(month.startDate(), month.endDate(AS_OF)))
            .thenReturn(invoices);
        when(invoiceRepository.findByPatientsUpTo(anyCollection(), eq(AS_OF))).thenReturn(patientsLedger);
        when(paymentRepository.findForInvoicesOrPatients(anyCollection(), anyCollection(), eq(AS_OF)))
            .thenReturn(payments);
        when(patientRepository.findByIdIn(anyCollection())).thenReturn(patients);
    }

    private void givenStandardNovember() {
        List<Invoice> november = invoices().stream()
            .filter(i -> YearMonth.from(i.getInvoiceDate()).equals(NOVEMBER.month()))
            .toList();
        givenMonth(NOVEMBER, november, invoices(), payments(), patients());
    }

    private static PatientSummary find(Statement.Section section, long patientId) {
        return section.patients().stream()
            .filter(p -> p.patientId() == patientId)
            .findFirst()
            .orElseThrow(() -> new AssertionError("Patient " + patientId + " not in " + section.type()));
    }

    private static InvoiceResult invoiceResult(PatientSummary patient, long invoiceId) {
        return patient.invoices().stream()
            .filter(i -> i.invoiceId() == invoiceId)
            .findFirst()
            .orElseThrow();
    }

    // ==================== Worked scenarios ====================

    @Test
    void generateStatement_fullyPaidPatient_inPaidSection() {
        givenStandardNovember();

        Statement statement = statementService.generateStatement(NOVEMBER, AS_OF);

        PatientSummary alice = find(statement.paid(), 1L);
        assertEquals(new BigDecimal("0.00"), alice.balance());
        assertEquals(AccountStatus.PAID, alice.accountStatus());
        assertEquals(1, statement.paid().patients().size());
    }

    @Test
    void generateStatement_partialPayment_agedIntoThirtyOneToSixty() {
        givenLedger(invoices(), payments(), patients());

        Statement statement = statementService.generateStatement(StatementScope.allOutstanding(), AS_OF);

        PatientSummary bruno = find(statement.unpaid(), 2L);
        assertEquals(new BigDecimal("150.00"), bruno.balance());
        assertEquals(45, bruno.maxAgingDays());
        assertEquals(AgingBucket.DAYS_31_60, bruno.invoices().get(0).agingBucket());
    }

    @Test
    void generateStatement_anyOutstandingInvoice_keepsPatientUnpaid() {
        givenStandardNovember();

        Statement statement = statementService.generateStatement(NOVEMBER, AS_OF);

        PatientSummary chloe = find(statement.unpaid(), 3L);
        assertEquals(new BigDecimal("0.00"), invoiceResult(chloe, 31L).balanceDue());
        assertEquals(new BigDecimal("20.00"), invoiceResult(chloe, 32L).balanceDue());
        assertEquals(new BigDecimal("160.00"), chloe.totalInvoiced());
        assertEquals(new BigDecimal("140.00"), chloe.paymentsReceived());
    }

    @Test
    void generateStatement_unattributedPayment_allocatedOldestFirst() {
        givenLedger(invoices(), payments(), patients());

        Statement statement = statementService.generateStatement(StatementScope.allOutstanding(), AS_OF);

        // 10.00 clears invoice 41, which is then left off; 20.00 goes to invoice 42
        PatientSummary daniel = find(statement.unpaid(), 4L);
        assertEquals(1, daniel.invoices().size());
        assertEquals(new BigDecimal("20.00"), invoiceResult(daniel, 42L).totalPaid());
        assertEquals(new BigDecimal("30.00"), invoiceResult(daniel, 42L).balanceDue());
        assertEquals(new BigDecimal("30.00"), daniel.balance());
    }

    @Test
    void generateStatement_monthScope_paymentClearingEarlierMonthNotCountedAgain() {
        List<Invoice> ledger = List.of(
            invoice(51L, 5L, AS_OF.minusDays(51), "100.00"),
            invoice(52L, 5L, AS_OF.minusDays(20), "50.00"));
        givenMonth(NOVEMBER, List.of(invoice(52L, 5L, AS_OF.minusDays(20), "50.00")), ledger,
            List.of(payment(501L, 5L, null, "100.00", AS_OF.minusDays(41))),
            List.of(patient(5L, "Emma", "Gagnon")));

        Statement statement = statementService.generateStatement(NOVEMBER, AS_OF);

        assertTrue(statement.paid().isEmpty());
        PatientSummary emma = find(statement.unpaid(), 5L);
        assertEquals(new BigDecimal("0.00"), emma.paymentsReceived());
        assertEquals(new BigDecimal("50.00"), emma.balance());
        assertEquals(new BigDecimal("50.00"), invoiceResult(emma, 52L).balanceDue());
        assertTrue(invoiceResult(emma, 52L).payments().isEmpty());
        assertTrue(statement.warnings().isEmpty());
    }

    @Test
    void generateStatement_monthScope_unattributedPaymentClearsThatMonth() {
        StatementScope october = StatementScope.ofMonth(2025, 10);
        List<Invoice> ledger = List.of(
            invoice(51L, 5L, AS_OF.minusDays(51), "100.00"),
            invoice(52L, 5L, AS_OF.minusDays(20), "50.00"));
        givenMonth(october, List.of(invoice(51L, 5L, AS_OF.minusDays(51), "100.00")), ledger,
            List.of(payment(501L, 5L, null, "100.00", AS_OF.minusDays(41))),
            List.of(patient(5L, "Emma", "Gagnon")));

        Statement statement = statementService.generateStatement(october, AS_OF);

        PatientSummary emma = find(statement.paid(), 5L);
        assertEquals(new BigDecimal("100.00"), emma.paymentsReceived());
        assertEquals(new BigDecimal("0.00"), emma.unappliedCredit());
        assertTrue(statement.unpaid().isEmpty());
    }

    // ==================== Statement-wide properties ====================

    @Test
    void generateStatement_balanceIsInvoicedMinusReceived() {
        givenLedger(invoices(), payments(), patients());

        Statement statement = statementService.generateStatement(StatementScope.allOutstanding(), AS_OF);

        for (Statement.Section section : List.of(statement.paid(), statement.unpaid())) {
            for (PatientSummary patient : section.patients()) {
                assertEquals(patient.totalInvoiced().subtract(patient.paymentsReceived()), patient.balance());
                assertTrue(patient.balance().signum() >= 0);
                for (InvoiceResult invoice : patient.invoices()) {
                    assertTrue(invoice.balanceDue().signum() >= 0);
                }
            }
        }
        SectionTotals grand = statement.grandTotals();
        assertEquals(new BigDecimal("310.00"), grand.totalInvoiced());
        assertEquals(new BigDecimal("110.00"), grand.paymentsReceived());
        assertEquals(new BigDecimal("200.00"), grand.balance());
    }

    @Test
    void generateStatement_allOutstanding_listsOnlyOwingInvoices() {
        givenLedger(invoices(), payments(), patients());

        Statement statement = statementService.generateStatement(StatementScope.allOutstanding(), AS_OF);

        assertTrue(statement.paid().isEmpty());
        assertEquals(List.of(2L, 3L, 4L),
            statement.unpaid().patients().stream().map(PatientSummary::patientId).toList());
        assertEquals(3, statement.grandTotals().invoiceCount());
        for (PatientSummary patient : statement.unpaid().patients()) {
            for (InvoiceResult invoice : patient.invoices()) {
                assertTrue(invoice.isOutstanding(), "Invoice " + invoice.invoiceId());
            }
        }
    }

    @Test
    void generateStatement_everyPatientInExactlyOneSection() {
        givenStandardNovember();

        Statement statement = statementService.generateStatement(NOVEMBER, AS_OF);

        Set<Long> seen = new HashSet<>();
        for (PatientSummary patient : statement.paid().patients()) {
            assertTrue(seen.add(patient.patientId()));
        }
        for (PatientSummary patient : statement.unpaid().patients()) {
            assertTrue(seen.add(patient.patientId()));
        }
        assertEquals(Set.of(1L, 3L, 4L), seen);
        assertEquals(3, statement.grandTotals().patientCount());
        assertEquals(4, statement.grandTotals().invoiceCount());
    }

    @Test
    void generateStatement_sameLedgerAndDate_equalStatements() {
        givenLedger(invoices(), payments(), patients());

        Statement first = statementService.generateStatement(StatementScope.allOutstanding(), AS_OF);
        Statement second = statementService.generateStatement(StatementScope.allOutstanding(), AS_OF);

        assertEquals(first, second);
    }

    @Test
    void generateStatement_defaultsAsOfToToday() {
        givenLedger(invoices(), payments(), patients());

        Statement statement = statementService.generateStatement(StatementScope.allOutstanding());

        assertEquals(AS_OF, statement.asOfDate());
        assertEquals(AS_OF, statement.periodEnd());
        assertNull(statement.periodStart());
        assertEquals("all-outstanding", statement.generatedScope());
    }

    @Test
    void generateStatement_monthScope_describesPeriod() {
        StatementScope scope = StatementScope.ofMonth(2025, 10);
        when(invoiceRepository.findWithLinesByDateRange(LocalDate.of(2025, 10, 1), LocalDate.of(2025, 10, 31)))
            .thenReturn(List.of(invoice(21L, 2L, AS_OF.minusDays(45), "200.00")));
        when(paymentRepository.findForInvoicesOrPatients(anyCollection(), anyCollection(), eq(AS_OF)))
            .thenReturn(List.of(payment(102L, 2L, 21L, "50.00", AS_OF.minusDays(40))));
        when(patientRepository.findByIdIn(anyCollection())).thenReturn(patients());

        Statement statement = statementService.generateStatement(scope, AS_OF);

        assertEquals("2025-10", statement.generatedScope());
        assertEquals(LocalDate.of(2025, 10, 1), statement.periodStart());
        assertEquals(LocalDate.of(2025, 10, 31), statement.periodEnd());
        assertEquals(1, statement.unpaid().patients().size());
        assertTrue(statement.paid().isEmpty());
    }

    @Test
    void generateStatement_emptyScope_returnsEmptySections() {
        when(invoiceRepository.findWithLinesByDateRange(any(), any())).thenReturn(List.of());

        Statement statement = statementService.generateStatement(StatementScope.ofMonth(2025, 11), AS_OF);

        assertTrue(statement.paid().isEmpty());
        assertTrue(statement.unpaid().isEmpty());
        assertEquals(SectionTotals.EMPTY, statement.grandTotals());
        assertTrue(statement.warnings().isEmpty());
    }

    // ==================== Data quality ====================

    @Test
    void generateStatement_missingPatient_stillListedWithWarning() {
        givenLedger(List.of(invoice(21L, 2L, AS_OF.minusDays(45), "200.00")), List.of(), List.of());

        Statement statement = statementService.generateStatement(StatementScope.allOutstanding(), AS_OF);

        PatientSummary unknown = find(statement.unpaid(), 2L);
        assertEquals("2", unknown.patientName());
        assertEquals(WarningType.MISSING_PATIENT, statement.warnings().get(0).type());
    }

    @Test
    void generateStatement_settledByAllocation_warnsAboutStoredStatus() {
        StatementScope september = StatementScope.ofMonth(2025, 9);
        givenMonth(september, List.of(invoices().get(4)), invoices(), payments(), patients());

        Statement statement = statementService.generateStatement(september, AS_OF);

        // Daniel's September invoice is settled by allocation while still marked PENDING
        find(statement.paid(), 4L);
        assertEquals(1, statement.warnings().size());
        StatementWarning warning = statement.warnings().get(0);
        assertEquals(WarningType.STATUS_MISMATCH, warning.type());
        assertEquals(41L, warning.invoiceId());
    }

    // ==================== Errors ====================

    @Test
    void generateStatement_storeUnavailable_throwsLedgerReadException() {
        when(invoiceRepository.findWithLinesUpTo(AS_OF)).thenThrow(new QueryTimeoutException("timeout"));

        assertThrows(LedgerReadException.class,
            () -> statementService.generateStatement(StatementScope.allOutstanding(), AS_OF));
    }

    @Test
    void generateStatement_nullScope_throwsInvalidScope() {
        assertThrows(InvalidStatementScopeException.class,
            () -> statementService.generateStatement(null, AS_OF));
        verifyNoInteractions(invoiceRepository);
    }

    // ==================== Single patient and invoice ====================

    @Test
    void generatePatientStatement_returnsThatPatient() {
        givenStandardNovember();

        PatientSummary chloe = statementService.generatePatientStatement(NOVEMBER, 3L, AS_OF);

        assertEquals("Chloe Nguyen", chloe.patientName());
        assertEquals(2, chloe.invoices().size());
        assertEquals(List.of("Consultation"),
            chloe.services().stream().map(PatientSummary.BilledService::description).toList());
    }

    @Test
    void generatePatientStatement_patientNotInScope_throws() {
        givenLedger(invoices(), payments(), patients());

        assertThrows(IllegalArgumentException.class,
            () -> statementService.generatePatientStatement(StatementScope.allOutstanding(), 77L, AS_OF));
    }

    @Test
    void generatePatientStatement_allOutstandingSettledPatient_throws() {
        givenLedger(invoices(), payments(), patients());

        assertThrows(IllegalArgumentException.class,
            () -> statementService.generatePatientStatement(StatementScope.allOutstanding(), 1L, AS_OF));
    }

    @Test
    void generateInvoiceStatement_includesAllocatedPaymentsAndInsuranceNumber() {
        Patient daniel = patient(4L, "Daniel", "Roy");
        daniel.setInsuranceNumber("3456-789-012");
        List<Invoice> danielsInvoices = List.of(
            invoice(41L, 4L, AS_OF.minusDays(70), "10.00"),
            invoice(42L, 4L, AS_OF.minusDays(25), "50.00"));
        when(invoiceRepository.findById(42L)).thenReturn(Optional.of(danielsInvoices.get(1)));
        when(invoiceRepository.findWithLinesByPatientUpTo(4L, AS_OF)).thenReturn(danielsInvoices);
        when(paymentRepository.findForInvoicesOrPatients(anyCollection(), anyCollection(), eq(AS_OF)))
            .thenReturn(List.of(payment(105L, 4L, null, "30.00", AS_OF.minusDays(3))));
        when(patientRepository.findByIdIn(anyCollection())).thenReturn(List.of(daniel));

        InvoiceStatement statement = statementService.generateInvoiceStatement(42L, AS_OF);

        assertEquals("Daniel Roy", statement.patientName());
        assertEquals("3456-789-012", statement.insuranceNumber());
        assertEquals(42L, statement.invoice().invoiceId());
        assertEquals(new BigDecimal("20.00"), statement.invoice().totalPaid());
        assertEquals(new BigDecimal("30.00"), statement.invoice().balanceDue());
        assertEquals(25, statement.invoice().daysOutstanding());
    }

    @Test
    void generateInvoiceStatement_unknownInvoice_throws() {
        when(invoiceRepository.findById(5L)).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> statementService.generateInvoiceStatement(5L, AS_OF));
    }

    @Test
    void generateInvoiceStatement_invoiceAfterAsOfDate_throws() {
        when(invoiceRepository.findById(9L))
            .thenReturn(Optional.of(invoice(9L, 1L, AS_OF.plusDays(2), "40.00")));

        assertThrows(IllegalArgumentException.class, () -> statementService.generateInvoiceStatement(9L, AS_OF));
        verifyNoInteractions(paymentRepository);
    }
}
