package com.example.clinic.service;

import com.example.clinic.service.Statement.Section;
import com.example.clinic.service.Statement.SectionType;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Puts the classified sections together with the scope descriptor. No arithmetic beyond adding
 * the two section totals.
 */
@Service
public class StatementAssembler {

    public Statement assemble(StatementScope scope, LocalDate asOfDate,
                              StatementClassifier.ClassifiedSummaries classified) {
        Section paid = new Section(SectionType.PAID, classified.paid(), classified.paidTotals());
        Section unpaid = new Section(SectionType.UNPAID, classified.unpaid(), classified.unpaidTotals());

        List<StatementWarning> warnings = new ArrayList<>();
        // Unpaid first: those are the entries staff act on
        for (PatientSummary patient : classified.unpaid()) {
            warnings.addAll(patient.allWarnings());
        }
        for (PatientSummary patient : classified.paid()) {
            warnings.addAll(patient.allWarnings());
        }

        return new Statement(
            scope.label(),
            scope,
            asOfDate,
            scope.startDate(),
            scope.endDate(asOfDate),
            paid,
            unpaid,
            classified.paidTotals().add(classified.unpaidTotals()),
            List.copyOf(warnings)
        );
    }
}
