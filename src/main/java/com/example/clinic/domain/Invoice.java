package com.example.clinic.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A bill for services rendered to a patient, usually for a single visit.
 * The gross charge (sum of the lines) is split into an insurance portion and a patient portion.
 * The status column is maintained by the front desk and is advisory only: statements always
 * derive balances from the lines and the recorded payments.
 */
@Entity
@Table(name = "invoice")
public class Invoice {

    public enum InvoiceStatus {
        PENDING,
        PARTIAL,
        PAID
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Plain id rather than an association: invoices may outlive their patient record
    @NotNull
    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @Column(name = "visit_id")
    private Long visitId;

    @Size(max = 20)
    @Column(name = "invoice_number", length = 20)
    private String invoiceNumber;

    @NotNull
    @Column(name = "invoice_date", nullable = false)
    private LocalDate invoiceDate;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private InvoiceStatus status = InvoiceStatus.PENDING;

    @NotNull
    @PositiveOrZero
    @Column(name = "insurance_portion", nullable = false, precision = 19, scale = 2)
    private BigDecimal insurancePortion = BigDecimal.ZERO;

    @NotNull
    @PositiveOrZero
    @Column(name = "patient_portion", nullable = false, precision = 19, scale = 2)
    private BigDecimal patientPortion = BigDecimal.ZERO;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineIndex ASC")
    private List<InvoiceLine> lines = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    // Constructors
    public Invoice() {
    }

    public Invoice(Long patientId, LocalDate invoiceDate, BigDecimal insurancePortion,
                   BigDecimal patientPortion) {
        this.patientId = patientId;
        this.invoiceDate = invoiceDate;
        this.insurancePortion = insurancePortion;
        this.patientPortion = patientPortion;
    }

    // Helper methods
    public void addLine(InvoiceLine line) {
        lines.add(line);
        line.setInvoice(this);
        line.setLineIndex(lines.size());
    }

    public void removeLine(InvoiceLine line) {
        lines.remove(line);
        line.setInvoice(null);
    }

    public boolean isMarkedPaid() {
        return status == InvoiceStatus.PAID;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getPatientId() {
        return patientId;
    }

    public void setPatientId(Long patientId) {
        this.patientId = patientId;
    }

    public Long getVisitId() {
        return visitId;
    }

    public void setVisitId(Long visitId) {
        this.visitId = visitId;
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public void setInvoiceNumber(String invoiceNumber) {
        this.invoiceNumber = invoiceNumber;
    }

    public LocalDate getInvoiceDate() {
        return invoiceDate;
    }

    public void setInvoiceDate(LocalDate invoiceDate) {
        this.invoiceDate = invoiceDate;
    }

    public InvoiceStatus getStatus() {
        return status;
    }

    public void setStatus(InvoiceStatus status) {
        this.status = status;
    }

    public BigDecimal getInsurancePortion() {
        return insurancePortion;
    }

    public void setInsurancePortion(BigDecimal insurancePortion) {
        this.insurancePortion = insurancePortion;
    }

    public BigDecimal getPatientPortion() {
        return patientPortion;
    }

    public void setPatientPortion(BigDecimal patientPortion) {
        this.patientPortion = patientPortion;
    }

    public List<InvoiceLine> getLines() {
        return lines;
    }

    public void setLines(List<InvoiceLine> lines) {
        this.lines = lines;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
