package com.example.clinic.service;

import java.math.BigDecimal;

/**
 * Outstanding balance split across the aging buckets.
 */
public record AgingSummary(
    BigDecimal current,
    BigDecimal days31to60,
    BigDecimal days61to90,
    BigDecimal days90Plus
) {

    public static final AgingSummary EMPTY =
        new AgingSummary(Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO);

    public static AgingSummary of(InvoiceResult invoice) {
        return switch (invoice.agingBucket()) {
            case CURRENT -> new AgingSummary(invoice.balanceDue(), Amounts.ZERO, Amounts.ZERO, Amounts.ZERO);
            case DAYS_31_60 -> new AgingSummary(Amounts.ZERO, invoice.balanceDue(), Amounts.ZERO, Amounts.ZERO);
            case DAYS_61_90 -> new AgingSummary(Amounts.ZERO, Amounts.ZERO, invoice.balanceDue(), Amounts.ZERO);
            case DAYS_90_PLUS -> new AgingSummary(Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, invoice.balanceDue());
            case NOT_APPLICABLE -> EMPTY;
        };
    }

    public AgingSummary add(AgingSummary other) {
        return new AgingSummary(
            current.add(other.current),
            days31to60.add(other.days31to60),
            days61to90.add(other.days61to90),
            days90Plus.add(other.days90Plus));
    }

    public BigDecimal total() {
        return current.add(days31to60).add(days61to90).add(days90Plus);
    }
}
