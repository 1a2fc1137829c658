package com.example.clinic.service;

/**
 * A data-quality problem found while building a statement. Warnings never abort the statement;
 * they travel with the affected invoice or patient so billing staff can review them.
 *
 * @param invoiceId null for patient-level warnings
 */
public record StatementWarning(
    WarningType type,
    Long patientId,
    Long invoiceId,
    String message
) {

    public enum WarningType {
        /** Line items do not add up to the insurance + patient split. */
        INCONSISTENT_SPLIT,
        /** Invoice or payment references a patient that does not exist. */
        MISSING_PATIENT,
        /** Stored invoice status disagrees with the computed balance. */
        STATUS_MISMATCH,
        /** Payments tagged to an invoice exceed its patient portion. */
        OVERPAYMENT,
        /** Unattributed payments left over after every in-scope invoice was settled. */
        UNAPPLIED_CREDIT
    }

    public static StatementWarning forInvoice(WarningType type, Long patientId, Long invoiceId,
                                              String message) {
        return new StatementWarning(type, patientId, invoiceId, message);
    }

    public static StatementWarning forPatient(WarningType type, Long patientId, String message) {
        return new StatementWarning(type, patientId, null, message);
    }
}
