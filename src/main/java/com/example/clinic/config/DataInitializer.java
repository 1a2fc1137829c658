package com.example.clinic.config;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.clinic.domain.Invoice;
import com.example.clinic.domain.Invoice.InvoiceStatus;
import com.example.clinic.domain.InvoiceLine;
import com.example.clinic.domain.Patient;
import com.example.clinic.domain.Payment;
import com.example.clinic.domain.Payment.PaymentMethod;
import com.example.clinic.repository.InvoiceRepository;
import com.example.clinic.repository.PatientRepository;
import com.example.clinic.repository.PaymentRepository;

/**
 * Seeds a small demo ledger on application startup for development. Dates are relative to today
 * so the all-outstanding statement always shows one paid account, an account 45 days overdue, a
 * patient with one settled and one owing invoice, and an unattributed payment spread over two
 * invoices.
 */
@Component
public class DataInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

  private final PatientRepository patientRepository;
  private final InvoiceRepository invoiceRepository;
  private final PaymentRepository paymentRepository;
  private final Clock clock;

  @Value("${clinic.demo-data.enabled:false}")
  private boolean enabled;

  public DataInitializer(
      PatientRepository patientRepository,
      InvoiceRepository invoiceRepository,
      PaymentRepository paymentRepository,
      Clock clock) {
    this.patientRepository = patientRepository;
    this.invoiceRepository = invoiceRepository;
    this.paymentRepository = paymentRepository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (!enabled) {
      log.debug("Demo data disabled");
      return;
    }
    if (invoiceRepository.count() > 0) {
      log.info("Ledger already has invoices, skipping demo data");
      return;
    }

    LocalDate today = LocalDate.now(clock);
    log.info("Seeding demo billing data relative to {}", today);

    // Paid in full ten days ago
    Patient alice = createPatient("Alice", "Martin", "1234-567-890");
    Invoice aliceVisit =
        createInvoice(alice, "INV-1001", today.minusDays(10), "0.00", InvoiceStatus.PAID);
    aliceVisit.addLine(new InvoiceLine("Consultation", 1, new BigDecimal("100.00")));
    aliceVisit.setPatientPortion(new BigDecimal("100.00"));
    aliceVisit = invoiceRepository.save(aliceVisit);
    recordPayment(alice, aliceVisit, "100.00", today.minusDays(10), PaymentMethod.DEBIT_CARD);

    // Partly paid, 45 days old
    Patient bruno = createPatient("Bruno", "Tremblay", "2345-678-901");
    Invoice brunoVisit =
        createInvoice(bruno, "INV-1002", today.minusDays(45), "150.00", InvoiceStatus.PARTIAL);
    brunoVisit.addLine(new InvoiceLine("Consultation", 1, new BigDecimal("100.00")));
    brunoVisit.addLine(new InvoiceLine("Blood panel", 2, new BigDecimal("125.00")));
    brunoVisit.setPatientPortion(new BigDecimal("200.00"));
    brunoVisit = invoiceRepository.save(brunoVisit);
    recordPayment(bruno, brunoVisit, "50.00", today.minusDays(40), PaymentMethod.CASH);

    // One settled invoice and one still owing 20.00
    Patient chloe = createPatient("Chloe", "Nguyen", null);
    Invoice chloeFirst =
        createInvoice(chloe, "INV-1003", today.minusDays(20), "0.00", InvoiceStatus.PAID);
    chloeFirst.addLine(new InvoiceLine("Physiotherapy session", 1, new BigDecimal("80.00")));
    chloeFirst.setPatientPortion(new BigDecimal("80.00"));
    chloeFirst = invoiceRepository.save(chloeFirst);
    recordPayment(chloe, chloeFirst, "80.00", today.minusDays(18), PaymentMethod.CREDIT_CARD);

    Invoice chloeSecond =
        createInvoice(chloe, "INV-1004", today.minusDays(5), "40.00", InvoiceStatus.PARTIAL);
    chloeSecond.addLine(new InvoiceLine("Physiotherapy session", 1, new BigDecimal("80.00")));
    chloeSecond.setPatientPortion(new BigDecimal("40.00"));
    chloeSecond = invoiceRepository.save(chloeSecond);
    recordPayment(chloe, chloeSecond, "20.00", today.minusDays(5), PaymentMethod.E_TRANSFER);

    // Unattributed 30.00 across an older invoice owing 10.00 and a newer one owing 50.00
    Patient daniel = createPatient("Daniel", "Roy", "3456-789-012");
    Invoice danielOlder =
        createInvoice(daniel, "INV-1005", today.minusDays(70), "90.00", InvoiceStatus.PENDING);
    danielOlder.addLine(new InvoiceLine("X-ray", 1, new BigDecimal("100.00")));
    danielOlder.setPatientPortion(new BigDecimal("10.00"));
    invoiceRepository.save(danielOlder);

    Invoice danielNewer =
        createInvoice(daniel, "INV-1006", today.minusDays(25), "0.00", InvoiceStatus.PENDING);
    danielNewer.addLine(new InvoiceLine("Follow-up consultation", 1, new BigDecimal("50.00")));
    danielNewer.setPatientPortion(new BigDecimal("50.00"));
    invoiceRepository.save(danielNewer);

    Payment unattributed =
        new Payment(
            daniel.getId(), null, new BigDecimal("30.00"), today.minusDays(3), PaymentMethod.CASH);
    unattributed.setReference("Front desk");
    paymentRepository.save(unattributed);

    log.info(
        "Seeded {} patients, {} invoices, {} payments",
        patientRepository.count(),
        invoiceRepository.count(),
        paymentRepository.count());
  }

  private Patient createPatient(String firstName, String lastName, String insuranceNumber) {
    Patient patient = new Patient(firstName, lastName);
    patient.setInsuranceNumber(insuranceNumber);
    return patientRepository.save(patient);
  }

  private Invoice createInvoice(
      Patient patient,
      String invoiceNumber,
      LocalDate invoiceDate,
      String insurancePortion,
      InvoiceStatus status) {
    Invoice invoice =
        new Invoice(patient.getId(), invoiceDate, new BigDecimal(insurancePortion), BigDecimal.ZERO);
    invoice.setInvoiceNumber(invoiceNumber);
    invoice.setStatus(status);
    return invoice;
  }

  private void recordPayment(
      Patient patient, Invoice invoice, String amount, LocalDate paymentDate, PaymentMethod method) {
    Payment payment =
        new Payment(patient.getId(), invoice.getId(), new BigDecimal(amount), paymentDate, method);
    payment.setReference(invoice.getInvoiceNumber());
    paymentRepository.save(payment);
  }
}
