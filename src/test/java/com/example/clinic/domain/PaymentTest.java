package com.example.clinic.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class PaymentTest {

  @Test
  void isUnattributed_TracksInvoiceTag() {
    Payment payment =
        new Payment(1L, null, new BigDecimal("30.00"), LocalDate.of(2025, 11, 27), Payment.PaymentMethod.CASH);
    assertTrue(payment.isUnattributed());

    payment.setInvoiceId(42L);
    assertFalse(payment.isUnattributed());
  }
}
