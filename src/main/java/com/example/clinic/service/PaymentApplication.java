package com.example.clinic.service;

import com.example.clinic.domain.Payment.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * The part of one payment that was applied to one invoice. An unattributed payment spread over
 * two invoices produces two applications.
 *
 * @param amount the full payment amount as recorded
 * @param appliedAmount the share that reduced this invoice's balance
 * @param attributed true when the payment was recorded against this invoice
 */
public record PaymentApplication(
    Long paymentId,
    Long invoiceId,
    LocalDate paymentDate,
    PaymentMethod method,
    BigDecimal amount,
    BigDecimal appliedAmount,
    boolean attributed
) {}
