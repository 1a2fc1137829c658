package com.example.clinic.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for Invoice and InvoiceLine: line bookkeeping and line totals. */
class InvoiceTest {

  private Invoice invoice;

  @BeforeEach
  void setUp() {
    invoice =
        new Invoice(1L, LocalDate.of(2025, 11, 3), new BigDecimal("60.00"), new BigDecimal("40.00"));
  }

  // ==================== Lines ====================

  @Test
  void addLine_SetsBackReferenceAndIndex() {
    InvoiceLine consult = new InvoiceLine("Consultation", 1, new BigDecimal("75.00"));
    InvoiceLine lab = new InvoiceLine("Lab test", 1, new BigDecimal("25.00"));

    invoice.addLine(consult);
    invoice.addLine(lab);

    assertSame(invoice, consult.getInvoice());
    assertEquals(1, consult.getLineIndex());
    assertEquals(2, lab.getLineIndex());
    assertEquals(2, invoice.getLines().size());
  }

  @Test
  void removeLine_ClearsBackReference() {
    InvoiceLine consult = new InvoiceLine("Consultation", 1, new BigDecimal("75.00"));
    invoice.addLine(consult);

    invoice.removeLine(consult);

    assertNull(consult.getInvoice());
    assertTrue(invoice.getLines().isEmpty());
  }

  @Test
  void getLineTotal_MultipliesQuantity() {
    InvoiceLine line = new InvoiceLine("Physiotherapy session", 3, new BigDecimal("45.50"));
    assertEquals(new BigDecimal("136.50"), line.getLineTotal());
  }

  @Test
  void getLineTotal_RoundsHalfUpToCents() {
    InvoiceLine line = new InvoiceLine("Dressing", 3, new BigDecimal("0.335"));
    // 1.005 rounds up
    assertEquals(new BigDecimal("1.01"), line.getLineTotal());
  }

  @Test
  void getLineTotal_ZeroQuantity_IsZero() {
    InvoiceLine line = new InvoiceLine("Cancelled test", 0, new BigDecimal("80.00"));
    assertEquals(new BigDecimal("0.00"), line.getLineTotal());
  }

  // ==================== Status ====================

  @Test
  void newInvoice_IsPending() {
    assertEquals(Invoice.InvoiceStatus.PENDING, invoice.getStatus());
    assertFalse(invoice.isMarkedPaid());

    invoice.setStatus(Invoice.InvoiceStatus.PAID);
    assertTrue(invoice.isMarkedPaid());
  }
}
