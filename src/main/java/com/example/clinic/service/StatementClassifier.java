package com.example.clinic.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits patient summaries into the paid and unpaid sections.
 * Only the computed balance decides membership; the stored invoice status is never consulted.
 */
@Service
public class StatementClassifier {

    public record ClassifiedSummaries(
        List<PatientSummary> paid,
        SectionTotals paidTotals,
        List<PatientSummary> unpaid,
        SectionTotals unpaidTotals
    ) {}

    public ClassifiedSummaries classify(List<PatientSummary> summaries) {
        List<PatientSummary> paid = new ArrayList<>();
        List<PatientSummary> unpaid = new ArrayList<>();
        SectionTotals paidTotals = SectionTotals.EMPTY;
        SectionTotals unpaidTotals = SectionTotals.EMPTY;

        for (PatientSummary summary : summaries) {
            if (isPaid(summary)) {
                paid.add(summary);
                paidTotals = paidTotals.add(summary);
            } else {
                unpaid.add(summary);
                unpaidTotals = unpaidTotals.add(summary);
            }
        }

        return new ClassifiedSummaries(List.copyOf(paid), paidTotals, List.copyOf(unpaid), unpaidTotals);
    }

    /**
     * A patient is paid when nothing is owed on any of their invoices in scope.
     */
    public boolean isPaid(PatientSummary summary) {
        return summary.balance().signum() == 0 && !summary.hasOutstandingInvoice();
    }
}
