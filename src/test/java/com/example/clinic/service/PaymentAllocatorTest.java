package com.example.clinic.service;

import com.example.clinic.domain.Invoice;
import com.example.clinic.domain.Payment;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.example.clinic.service.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PaymentAllocator: unattributed payments go to the oldest outstanding invoice
 * first and never beyond what an invoice still owes.
 */
class PaymentAllocatorTest {

    private final PaymentAllocator allocator = new PaymentAllocator();

    private PaymentAllocator.Allocation allocate(List<Invoice> invoices, List<Payment> payments) {
        return allocator.allocate(snapshot(StatementScope.allOutstanding(), invoices, payments,
            List.of(patient(4L, "Daniel", "Roy"))));
    }

    @Test
    void allocate_clearsOlderInvoiceBeforeNewer() {
        List<Invoice> invoices = List.of(
            invoice(42L, 4L, AS_OF.minusDays(25), "50.00"),
            invoice(41L, 4L, AS_OF.minusDays(70), "10.00"));

        PaymentAllocator.Allocation allocation =
            allocate(invoices, List.of(payment(105L, 4L, null, "30.00", AS_OF.minusDays(3))));

        assertEquals(new BigDecimal("10.00"), allocation.applicationsFor(41L).get(0).appliedAmount());
        assertEquals(new BigDecimal("20.00"), allocation.applicationsFor(42L).get(0).appliedAmount());
        assertEquals(new BigDecimal("30.00"), allocation.applicationsFor(42L).get(0).amount());
        assertFalse(allocation.applicationsFor(41L).get(0).attributed());
        assertEquals(new BigDecimal("0.00"), allocation.unappliedFor(4L));
    }

    @Test
    void allocate_taggedPaymentsReduceRoom() {
        List<Invoice> invoices = List.of(
            invoice(41L, 4L, AS_OF.minusDays(70), "10.00"),
            invoice(42L, 4L, AS_OF.minusDays(25), "50.00"));
        List<Payment> payments = List.of(
            payment(100L, 4L, 41L, "10.00", AS_OF.minusDays(60)),
            payment(105L, 4L, null, "30.00", AS_OF.minusDays(3)));

        PaymentAllocator.Allocation allocation = allocate(invoices, payments);

        assertTrue(allocation.applicationsFor(41L).isEmpty());
        assertEquals(new BigDecimal("30.00"), allocation.applicationsFor(42L).get(0).appliedAmount());
    }

    @Test
    void allocate_moreThanOwed_leavesUnappliedCredit() {
        List<Invoice> invoices = List.of(
            invoice(41L, 4L, AS_OF.minusDays(70), "10.00"),
            invoice(42L, 4L, AS_OF.minusDays(25), "50.00"));

        PaymentAllocator.Allocation allocation =
            allocate(invoices, List.of(payment(105L, 4L, null, "100.00", AS_OF.minusDays(3))));

        assertEquals(new BigDecimal("10.00"), allocation.applicationsFor(41L).get(0).appliedAmount());
        assertEquals(new BigDecimal("50.00"), allocation.applicationsFor(42L).get(0).appliedAmount());
        assertEquals(new BigDecimal("40.00"), allocation.unappliedFor(4L));
    }

    @Test
    void allocate_severalPayments_appliedInPaymentDateOrder() {
        List<Invoice> invoices = List.of(
            invoice(41L, 4L, AS_OF.minusDays(70), "10.00"),
            invoice(42L, 4L, AS_OF.minusDays(25), "50.00"));
        List<Payment> payments = List.of(
            payment(107L, 4L, null, "25.00", AS_OF.minusDays(1)),
            payment(106L, 4L, null, "15.00", AS_OF.minusDays(6)));

        PaymentAllocator.Allocation allocation = allocate(invoices, payments);

        // 106 first: 10.00 to the older invoice, 5.00 to the newer one
        assertEquals(106L, allocation.applicationsFor(41L).get(0).paymentId());
        List<PaymentApplication> newer = allocation.applicationsFor(42L);
        assertEquals(2, newer.size());
        assertEquals(new BigDecimal("5.00"), newer.get(0).appliedAmount());
        assertEquals(107L, newer.get(1).paymentId());
        assertEquals(new BigDecimal("25.00"), newer.get(1).appliedAmount());
    }

    @Test
    void allocate_noUnattributedPayments_allocatesNothing() {
        PaymentAllocator.Allocation allocation = allocate(
            List.of(invoice(41L, 4L, AS_OF.minusDays(70), "10.00")),
            List.of(payment(100L, 4L, 41L, "5.00", AS_OF.minusDays(60))));

        assertTrue(allocation.applicationsByInvoice().isEmpty());
        assertTrue(allocation.unappliedByPatient().isEmpty());
    }

    @Test
    void allocate_paymentsStayWithTheirPatient() {
        List<Invoice> invoices = List.of(
            invoice(41L, 4L, AS_OF.minusDays(70), "10.00"),
            invoice(51L, 5L, AS_OF.minusDays(70), "10.00"));

        PaymentAllocator.Allocation allocation =
            allocate(invoices, List.of(payment(105L, 4L, null, "30.00", AS_OF.minusDays(3))));

        assertTrue(allocation.applicationsFor(51L).isEmpty());
        assertEquals(new BigDecimal("20.00"), allocation.unappliedFor(4L));
        assertEquals(new BigDecimal("0.00"), allocation.unappliedFor(5L));
    }

    @Test
    void allocate_olderInvoiceOutsideScope_takesItsShareFirst() {
        LedgerSnapshot snapshot = LedgerSnapshot.index(NOVEMBER, AS_OF,
            List.of(invoice(52L, 5L, AS_OF.minusDays(20), "50.00")),
            List.of(invoice(51L, 5L, AS_OF.minusDays(50), "100.00")),
            List.of(payment(501L, 5L, null, "100.00", AS_OF.minusDays(41))),
            List.of(patient(5L, "Emma", "Gagnon")));

        PaymentAllocator.Allocation allocation = allocator.allocate(snapshot);

        assertTrue(allocation.applicationsFor(51L).isEmpty());
        assertTrue(allocation.applicationsFor(52L).isEmpty());
        assertEquals(new BigDecimal("0.00"), allocation.unappliedFor(5L));
    }

    @Test
    void allocate_remainderAfterOlderInvoice_goesToInvoiceInScope() {
        LedgerSnapshot snapshot = LedgerSnapshot.index(NOVEMBER, AS_OF,
            List.of(invoice(52L, 5L, AS_OF.minusDays(20), "50.00")),
            List.of(invoice(51L, 5L, AS_OF.minusDays(50), "100.00")),
            List.of(payment(500L, 5L, 51L, "70.00", AS_OF.minusDays(45)),
                payment(501L, 5L, null, "45.00", AS_OF.minusDays(10))),
            List.of(patient(5L, "Emma", "Gagnon")));

        PaymentAllocator.Allocation allocation = allocator.allocate(snapshot);

        // 30.00 finishes invoice 51, the other 15.00 lands on 52
        List<PaymentApplication> inScope = allocation.applicationsFor(52L);
        assertEquals(1, inScope.size());
        assertEquals(new BigDecimal("15.00"), inScope.get(0).appliedAmount());
        assertTrue(allocation.applicationsFor(51L).isEmpty());
    }
}
