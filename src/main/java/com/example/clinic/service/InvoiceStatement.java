package com.example.clinic.service;

import java.time.LocalDate;
import java.util.List;

/**
 * Physician statement for a single invoice, as attached to an insurance or government claim.
 */
public record InvoiceStatement(
    LocalDate asOfDate,
    Long patientId,
    String patientName,
    String insuranceNumber,
    InvoiceResult invoice,
    List<StatementWarning> warnings
) {}
