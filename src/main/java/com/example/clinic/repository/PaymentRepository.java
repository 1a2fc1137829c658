package com.example.clinic.repository;

import com.example.clinic.domain.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    // Payments tagged to any of the invoices, or made by any of the patients (catches unattributed ones)
    @Query("SELECT p FROM Payment p WHERE (p.invoiceId IN :invoiceIds OR p.patientId IN :patientIds) " +
           "AND p.paymentDate <= :asOfDate ORDER BY p.paymentDate ASC, p.id ASC")
    List<Payment> findForInvoicesOrPatients(@Param("invoiceIds") Collection<Long> invoiceIds,
                                            @Param("patientIds") Collection<Long> patientIds,
                                            @Param("asOfDate") LocalDate asOfDate);
}
