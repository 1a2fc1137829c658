package com.example.clinic.repository;

import com.example.clinic.domain.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    // Invoices dated within [startDate, endDate], lines fetched in the same read
    @Query("SELECT DISTINCT i FROM Invoice i LEFT JOIN FETCH i.lines " +
           "WHERE i.invoiceDate >= :startDate AND i.invoiceDate <= :endDate " +
           "ORDER BY i.invoiceDate ASC, i.id ASC")
    List<Invoice> findWithLinesByDateRange(@Param("startDate") LocalDate startDate,
                                           @Param("endDate") LocalDate endDate);

    // Everything billed up to a date (all-outstanding statements)
    @Query("SELECT DISTINCT i FROM Invoice i LEFT JOIN FETCH i.lines " +
           "WHERE i.invoiceDate <= :asOfDate ORDER BY i.invoiceDate ASC, i.id ASC")
    List<Invoice> findWithLinesUpTo(@Param("asOfDate") LocalDate asOfDate);

    // The given patients' invoices up to a date, without lines (placing unattributed payments)
    @Query("SELECT i FROM Invoice i " +
           "WHERE i.patientId IN :patientIds AND i.invoiceDate <= :asOfDate " +
           "ORDER BY i.invoiceDate ASC, i.id ASC")
    List<Invoice> findByPatientsUpTo(@Param("patientIds") Collection<Long> patientIds,
                                     @Param("asOfDate") LocalDate asOfDate);

    // One patient's invoices up to a date (insurance statement drill-down)
    @Query("SELECT DISTINCT i FROM Invoice i LEFT JOIN FETCH i.lines " +
           "WHERE i.patientId = :patientId AND i.invoiceDate <= :asOfDate " +
           "ORDER BY i.invoiceDate ASC, i.id ASC")
    List<Invoice> findWithLinesByPatientUpTo(@Param("patientId") Long patientId,
                                             @Param("asOfDate") LocalDate asOfDate);
}
