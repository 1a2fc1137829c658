package com.example.clinic.service;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.text.NumberFormat;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.clinic.service.InvoiceResult.LineCharge;
import com.example.clinic.service.Statement.Section;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lowagie.text.Chunk;
import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.Rectangle;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;

/**
 * Service for exporting computed statements to PDF, Excel, CSV and JSON. Formatting only: every
 * figure comes from the statement as computed.
 */
@Service
public class StatementExportService {

  private static final Logger log = LoggerFactory.getLogger(StatementExportService.class);

  // PDF Fonts (using com.lowagie.text.Font explicitly)
  private static final Font TITLE_FONT = new Font(Font.HELVETICA, 16, Font.BOLD);
  private static final Font SUBTITLE_FONT =
      new Font(Font.HELVETICA, 11, Font.NORMAL, Color.DARK_GRAY);
  private static final Font SECTION_FONT = new Font(Font.HELVETICA, 12, Font.BOLD);
  private static final Font TABLE_HEADER_FONT = new Font(Font.HELVETICA, 9, Font.BOLD, Color.WHITE);
  private static final Font TABLE_CELL_FONT = new Font(Font.HELVETICA, 9, Font.NORMAL);
  private static final Font TABLE_CELL_BOLD = new Font(Font.HELVETICA, 9, Font.BOLD);
  private static final Font TOTAL_FONT = new Font(Font.HELVETICA, 10, Font.BOLD);
  private static final Font SMALL_FONT = new Font(Font.HELVETICA, 8, Font.NORMAL, Color.GRAY);

  // PDF Colors
  private static final Color HEADER_BG = new Color(52, 73, 94);
  private static final Color ALT_ROW_BG = new Color(245, 247, 249);
  private static final Color TOTAL_BG = new Color(230, 230, 230);
  private static final Color OVERDUE_COLOR = new Color(178, 34, 34);
  private static final Color WARNING_COLOR = new Color(231, 76, 60);

  @Value("${clinic.billing.clinic-name:Clinic}")
  private String clinicName = "Clinic";

  private final NumberFormat currencyFormat;
  private final DateTimeFormatter dateFormatter = DateTimeFormatter.ofPattern("d MMM yyyy");
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public StatementExportService(Clock clock) {
    this.clock = clock;
    this.currencyFormat = NumberFormat.getCurrencyInstance(Locale.CANADA);
    this.objectMapper =
        new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
  }

  // ==================== STATEMENT EXPORTS ====================

  /**
   * Exports a statement to PDF. Summary by section, then each section's patients, the aging of
   * unpaid balances and any data-quality warnings.
   */
  public byte[] exportStatementToPdf(Statement statement) {
    try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
      Document document = new Document(PageSize.A4.rotate()); // Landscape for more columns
      PdfWriter.getInstance(document, baos);
      document.open();

      addReportTitle(document, "Patient Statements");
      addReportSubtitle(document, describeScope(statement));

      // Summary
      addSectionHeader(document, "Summary");
      PdfPTable summaryTable = new PdfPTable(5);
      summaryTable.setWidthPercentage(100);
      summaryTable.setWidths(new float[] {3f, 1.2f, 2f, 2f, 2f});
      addTableHeader(summaryTable, "Section");
      addTableHeader(summaryTable, "Patients");
      addTableHeader(summaryTable, "Invoiced");
      addTableHeader(summaryTable, "Received");
      addTableHeader(summaryTable, "Balance");
      addSummaryRow(summaryTable, "Paid accounts", statement.paid().totals(), Color.WHITE);
      addSummaryRow(summaryTable, "Unpaid accounts", statement.unpaid().totals(), ALT_ROW_BG);
      addTotalCell(summaryTable, "Totals");
      addTotalCell(summaryTable, String.valueOf(statement.grandTotals().patientCount()));
      addTotalCell(summaryTable, formatCurrency(statement.grandTotals().totalInvoiced()));
      addTotalCell(summaryTable, formatCurrency(statement.grandTotals().paymentsReceived()));
      addTotalCell(summaryTable, formatCurrency(statement.grandTotals().balance()));
      document.add(summaryTable);

      addPatientSection(document, "Unpaid Accounts", statement.unpaid());
      addAgingSection(document, statement.unpaid());
      addPatientSection(document, "Paid Accounts", statement.paid());
      addWarningsSection(document, statement.warnings());

      addReportFooter(document);
      document.close();

      log.info("Generated statement PDF for {} ({} bytes)", statement.generatedScope(), baos.size());
      return baos.toByteArray();

    } catch (Exception e) {
      log.error("Failed to generate statement PDF for {}", statement.generatedScope(), e);
      throw new RuntimeException("Failed to generate statement PDF: " + e.getMessage(), e);
    }
  }

  /** Exports a statement to Excel: one sheet of patients, one of invoices. */
  public byte[] exportStatementToExcel(Statement statement) {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

      CellStyle headerStyle = createHeaderStyle(workbook);
      CellStyle currencyStyle = createCurrencyStyle(workbook);
      CellStyle titleStyle = createTitleStyle(workbook);
      CellStyle totalStyle = createTotalStyle(workbook);

      // Patients
      Sheet sheet = workbook.createSheet("Patients");
      int rowNum = 0;

      Row titleRow = sheet.createRow(rowNum++);
      Cell titleCell = titleRow.createCell(0);
      titleCell.setCellValue(clinicName + " - Patient Statements");
      titleCell.setCellStyle(titleStyle);
      sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, 11));

      Row scopeRow = sheet.createRow(rowNum++);
      scopeRow.createCell(0).setCellValue(describeScope(statement));

      rowNum++; // Empty row

      String[] headers = {
        "Section", "Patient ID", "Patient", "Status", "Invoiced", "Received", "Balance",
        "Current", "31-60 Days", "61-90 Days", "90+ Days", "Max Aging Days"
      };
      writeHeaderRow(sheet.createRow(rowNum++), headers, headerStyle);

      for (Section section : List.of(statement.unpaid(), statement.paid())) {
        for (PatientSummary patient : section.patients()) {
          Row row = sheet.createRow(rowNum++);
          row.createCell(0).setCellValue(section.type().getLabel());
          row.createCell(1).setCellValue(patient.patientId());
          row.createCell(2).setCellValue(patient.patientName());
          row.createCell(3).setCellValue(patient.accountStatus().name());
          setCurrency(row.createCell(4), patient.totalInvoiced(), currencyStyle);
          setCurrency(row.createCell(5), patient.paymentsReceived(), currencyStyle);
          setCurrency(row.createCell(6), patient.balance(), currencyStyle);
          setCurrency(row.createCell(7), patient.aging().current(), currencyStyle);
          setCurrency(row.createCell(8), patient.aging().days31to60(), currencyStyle);
          setCurrency(row.createCell(9), patient.aging().days61to90(), currencyStyle);
          setCurrency(row.createCell(10), patient.aging().days90Plus(), currencyStyle);
          row.createCell(11).setCellValue(patient.maxAgingDays());
        }
      }

      SectionTotals totals = statement.grandTotals();
      Row totalsRow = sheet.createRow(rowNum);
      Cell totalLabel = totalsRow.createCell(0);
      totalLabel.setCellValue("Totals");
      totalLabel.setCellStyle(totalStyle);
      setCurrency(totalsRow.createCell(4), totals.totalInvoiced(), totalStyle);
      setCurrency(totalsRow.createCell(5), totals.paymentsReceived(), totalStyle);
      setCurrency(totalsRow.createCell(6), totals.balance(), totalStyle);
      setCurrency(totalsRow.createCell(7), totals.aging().current(), totalStyle);
      setCurrency(totalsRow.createCell(8), totals.aging().days31to60(), totalStyle);
      setCurrency(totalsRow.createCell(9), totals.aging().days61to90(), totalStyle);
      setCurrency(totalsRow.createCell(10), totals.aging().days90Plus(), totalStyle);

      setColumnWidths(sheet, 10, 11, 28, 10, 14, 14, 14, 14, 14, 14, 14, 15);

      // Invoices
      Sheet invoiceSheet = workbook.createSheet("Invoices");
      int invoiceRowNum = 0;
      String[] invoiceHeaders = {
        "Invoice ID", "Invoice #", "Patient ID", "Invoice Date", "Gross", "Insurance",
        "Patient Portion", "Paid", "Balance Due", "Days Outstanding", "Aging", "Flags"
      };
      writeHeaderRow(invoiceSheet.createRow(invoiceRowNum++), invoiceHeaders, headerStyle);

      for (Section section : List.of(statement.unpaid(), statement.paid())) {
        for (PatientSummary patient : section.patients()) {
          for (InvoiceResult invoice : patient.invoices()) {
            Row row = invoiceSheet.createRow(invoiceRowNum++);
            row.createCell(0).setCellValue(invoice.invoiceId());
            row.createCell(1).setCellValue(nullToEmpty(invoice.invoiceNumber()));
            row.createCell(2).setCellValue(invoice.patientId());
            row.createCell(3).setCellValue(invoice.invoiceDate().toString());
            setCurrency(row.createCell(4), invoice.grossCharge(), currencyStyle);
            setCurrency(row.createCell(5), invoice.insurancePortion(), currencyStyle);
            setCurrency(row.createCell(6), invoice.patientPortion(), currencyStyle);
            setCurrency(row.createCell(7), invoice.totalPaid(), currencyStyle);
            setCurrency(row.createCell(8), invoice.balanceDue(), currencyStyle);
            row.createCell(9).setCellValue(invoice.daysOutstanding());
            row.createCell(10).setCellValue(invoice.agingBucket().getLabel());
            row.createCell(11).setCellValue(describeFlags(invoice.warnings()));
          }
        }
      }
      setColumnWidths(invoiceSheet, 11, 12, 11, 13, 14, 14, 15, 14, 14, 16, 10, 30);

      workbook.write(baos);
      log.info("Generated statement Excel for {} ({} bytes)", statement.generatedScope(), baos.size());
      return baos.toByteArray();

    } catch (IOException e) {
      log.error("Failed to generate statement Excel for {}", statement.generatedScope(), e);
      throw new RuntimeException("Failed to generate statement Excel: " + e.getMessage(), e);
    }
  }

  /** Exports a statement to CSV, one row per patient. */
  public byte[] exportStatementToCsv(Statement statement) {
    StringBuilder csv = new StringBuilder();
    csv.append('\uFEFF'); // UTF-8 BOM

    csv.append(escapeCsvField(clinicName)).append(" - Patient Statements\n");
    csv.append(escapeCsvField(describeScope(statement))).append("\n\n");

    csv.append("Section,Patient ID,Patient,Status,Invoiced,Received,Balance,")
        .append("Current,31-60 Days,61-90 Days,90+ Days,Max Aging Days\n");

    for (Section section : List.of(statement.unpaid(), statement.paid())) {
      for (PatientSummary patient : section.patients()) {
        csv.append(section.type().getLabel()).append(",");
        csv.append(patient.patientId()).append(",");
        csv.append(escapeCsvField(patient.patientName())).append(",");
        csv.append(patient.accountStatus().name()).append(",");
        csv.append(patient.totalInvoiced().toPlainString()).append(",");
        csv.append(patient.paymentsReceived().toPlainString()).append(",");
        csv.append(patient.balance().toPlainString()).append(",");
        csv.append(patient.aging().current().toPlainString()).append(",");
        csv.append(patient.aging().days31to60().toPlainString()).append(",");
        csv.append(patient.aging().days61to90().toPlainString()).append(",");
        csv.append(patient.aging().days90Plus().toPlainString()).append(",");
        csv.append(patient.maxAgingDays()).append("\n");
      }
    }

    SectionTotals totals = statement.grandTotals();
    csv.append("Totals,,,,");
    csv.append(totals.totalInvoiced().toPlainString()).append(",");
    csv.append(totals.paymentsReceived().toPlainString()).append(",");
    csv.append(totals.balance().toPlainString()).append(",");
    csv.append(totals.aging().current().toPlainString()).append(",");
    csv.append(totals.aging().days31to60().toPlainString()).append(",");
    csv.append(totals.aging().days61to90().toPlainString()).append(",");
    csv.append(totals.aging().days90Plus().toPlainString()).append(",\n");

    log.info("Generated statement CSV for {} ({} bytes)", statement.generatedScope(), csv.length());
    return csv.toString().getBytes(StandardCharsets.UTF_8);
  }

  /** Exports a statement as indented JSON. */
  public byte[] exportStatementToJson(Statement statement) {
    try {
      byte[] json = objectMapper.writeValueAsBytes(statement);
      log.info("Generated statement JSON for {} ({} bytes)", statement.generatedScope(), json.length);
      return json;
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize statement {}", statement.generatedScope(), e);
      throw new RuntimeException("Failed to generate statement JSON: " + e.getMessage(), e);
    }
  }

  // ==================== PHYSICIAN STATEMENT EXPORT ====================

  /**
   * Exports a physician statement for one invoice to PDF, for submission with an insurance or
   * government claim.
   */
  public byte[] exportInvoiceStatementToPdf(InvoiceStatement statement) {
    InvoiceResult invoice = statement.invoice();
    try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
      Document document = new Document(PageSize.A4);
      PdfWriter.getInstance(document, baos);
      document.open();

      addReportTitle(document, "Physician Statement");
      addReportSubtitle(document, "Invoice " + invoiceLabel(invoice) + " dated "
          + invoice.invoiceDate().format(dateFormatter));

      // Patient block
      PdfPTable patientTable = new PdfPTable(2);
      patientTable.setWidthPercentage(60);
      patientTable.setHorizontalAlignment(Element.ALIGN_LEFT);
      addLabelValue(patientTable, "Patient", statement.patientName());
      addLabelValue(patientTable, "Patient ID", String.valueOf(statement.patientId()));
      addLabelValue(patientTable, "Insurance #",
          statement.insuranceNumber() != null ? statement.insuranceNumber() : "N/A");
      if (invoice.visitId() != null) {
        addLabelValue(patientTable, "Visit", String.valueOf(invoice.visitId()));
      }
      document.add(patientTable);

      // Services
      addSectionHeader(document, "Services");
      PdfPTable lineTable = new PdfPTable(4);
      lineTable.setWidthPercentage(100);
      lineTable.setWidths(new float[] {5f, 1f, 2f, 2f});
      addTableHeader(lineTable, "Description");
      addTableHeader(lineTable, "Qty");
      addTableHeader(lineTable, "Unit Price");
      addTableHeader(lineTable, "Total");
      boolean alternate = false;
      for (LineCharge line : invoice.lines()) {
        Color bg = alternate ? ALT_ROW_BG : Color.WHITE;
        addTableCell(lineTable, nullToEmpty(line.description()), bg, Element.ALIGN_LEFT);
        addTableCell(lineTable, String.valueOf(line.qty()), bg, Element.ALIGN_RIGHT);
        addTableCell(lineTable, formatCurrency(line.unitPrice()), bg, Element.ALIGN_RIGHT);
        addTableCell(lineTable, formatCurrency(line.lineTotal()), bg, Element.ALIGN_RIGHT);
        alternate = !alternate;
      }
      addTotalCell(lineTable, "");
      addTotalCell(lineTable, "");
      addTotalCell(lineTable, "Subtotal");
      addTotalCell(lineTable, formatCurrency(invoice.grossCharge()));
      document.add(lineTable);

      // Split and payments
      addSectionHeader(document, "Charges and Payments");
      PdfPTable amountsTable = new PdfPTable(2);
      amountsTable.setWidthPercentage(50);
      amountsTable.setHorizontalAlignment(Element.ALIGN_RIGHT);
      addAmountRow(amountsTable, "Insurance portion", invoice.insurancePortion());
      addAmountRow(amountsTable, "Patient portion", invoice.patientPortion());
      for (PaymentApplication payment : invoice.payments()) {
        addAmountRow(amountsTable,
            "Payment " + payment.paymentDate().format(dateFormatter) + " (" + payment.method() + ")",
            payment.appliedAmount().negate());
      }
      addGrandTotalRow(amountsTable, "Balance Due", invoice.balanceDue());
      document.add(amountsTable);

      if (invoice.isOutstanding()) {
        Paragraph aging =
            new Paragraph(
                "Outstanding " + invoice.daysOutstanding() + " days (" + invoice.agingBucket().getLabel() + ")",
                new Font(Font.HELVETICA, 9, Font.NORMAL, OVERDUE_COLOR));
        aging.setSpacingBefore(8);
        document.add(aging);
      }

      addWarningsSection(document, statement.warnings());

      Paragraph note =
          new Paragraph(
              "For insurance claims, please submit this statement with your claim form.", SMALL_FONT);
      note.setSpacingBefore(15);
      document.add(note);

      addReportFooter(document);
      document.close();

      log.info("Generated physician statement PDF for invoice {} ({} bytes)",
          invoice.invoiceId(), baos.size());
      return baos.toByteArray();

    } catch (Exception e) {
      log.error("Failed to generate physician statement PDF for invoice {}", invoice.invoiceId(), e);
      throw new RuntimeException("Failed to generate physician statement PDF: " + e.getMessage(), e);
    }
  }

  // ==================== PDF SECTION BUILDERS ====================

  private void addPatientSection(Document document, String title, Section section)
      throws DocumentException {
    addSectionHeader(document, title + " (" + section.patients().size() + ")");
    if (section.patients().isEmpty()) {
      document.add(new Paragraph("None", TABLE_CELL_FONT));
      return;
    }

    PdfPTable table = new PdfPTable(7);
    table.setWidthPercentage(100);
    table.setWidths(new float[] {3f, 1f, 2f, 2f, 2f, 1.3f, 1.3f});
    addTableHeader(table, "Patient");
    addTableHeader(table, "Invoices");
    addTableHeader(table, "Invoiced");
    addTableHeader(table, "Received");
    addTableHeader(table, "Balance");
    addTableHeader(table, "Max Aging");
    addTableHeader(table, "Status");

    boolean alternate = false;
    for (PatientSummary patient : section.patients()) {
      Color bg = alternate ? ALT_ROW_BG : Color.WHITE;
      addTableCell(table, patient.patientName(), bg, Element.ALIGN_LEFT);
      addTableCell(table, String.valueOf(patient.invoices().size()), bg, Element.ALIGN_RIGHT);
      addTableCell(table, formatCurrency(patient.totalInvoiced()), bg, Element.ALIGN_RIGHT);
      addTableCell(table, formatCurrency(patient.paymentsReceived()), bg, Element.ALIGN_RIGHT);
      addAgingCell(table, patient.balance(), bg, patient.maxAgingDays());
      addTableCell(table, patient.maxAgingDays() + " days", bg, Element.ALIGN_RIGHT);
      addTableCell(table, patient.accountStatus().name(), bg, Element.ALIGN_CENTER);
      alternate = !alternate;
    }

    SectionTotals totals = section.totals();
    addTotalCell(table, "Totals");
    addTotalCell(table, String.valueOf(totals.invoiceCount()));
    addTotalCell(table, formatCurrency(totals.totalInvoiced()));
    addTotalCell(table, formatCurrency(totals.paymentsReceived()));
    addTotalCell(table, formatCurrency(totals.balance()));
    addTotalCell(table, "");
    addTotalCell(table, "");
    document.add(table);
  }

  private void addAgingSection(Document document, Section unpaid) throws DocumentException {
    if (unpaid.patients().isEmpty()) {
      return;
    }
    addSectionHeader(document, "Aging of Unpaid Balances");

    PdfPTable table = new PdfPTable(6);
    table.setWidthPercentage(100);
    table.setWidths(new float[] {3f, 1.5f, 1.5f, 1.5f, 1.5f, 2f});
    addTableHeader(table, "Patient");
    addTableHeader(table, "Current");
    addTableHeader(table, "31-60 Days");
    addTableHeader(table, "61-90 Days");
    addTableHeader(table, "90+ Days");
    addTableHeader(table, "Total");

    boolean alternate = false;
    for (PatientSummary patient : unpaid.patients()) {
      Color bg = alternate ? ALT_ROW_BG : Color.WHITE;
      AgingSummary aging = patient.aging();
      addTableCell(table, patient.patientName(), bg, Element.ALIGN_LEFT);
      addTableCell(table, formatCurrency(aging.current()), bg, Element.ALIGN_RIGHT);
      addAgingCell(table, aging.days31to60(), bg, 31);
      addAgingCell(table, aging.days61to90(), bg, 61);
      addAgingCell(table, aging.days90Plus(), bg, 91);
      addTableCell(table, formatCurrency(aging.total()), bg, Element.ALIGN_RIGHT);
      alternate = !alternate;
    }

    AgingSummary totals = unpaid.totals().aging();
    addTotalCell(table, "Totals");
    addTotalCell(table, formatCurrency(totals.current()));
    addTotalCell(table, formatCurrency(totals.days31to60()));
    addTotalCell(table, formatCurrency(totals.days61to90()));
    addTotalCell(table, formatCurrency(totals.days90Plus()));
    addTotalCell(table, formatCurrency(totals.total()));
    document.add(table);
  }

  private void addWarningsSection(Document document, List<StatementWarning> warnings)
      throws DocumentException {
    if (warnings.isEmpty()) {
      return;
    }
    addSectionHeader(document, "Items for Review (" + warnings.size() + ")");
    Font warningFont = new Font(Font.HELVETICA, 9, Font.NORMAL, WARNING_COLOR);
    for (StatementWarning warning : warnings) {
      StringBuilder text = new StringBuilder();
      text.append(warning.type()).append(" - patient ").append(warning.patientId());
      if (warning.invoiceId() != null) {
        text.append(", invoice ").append(warning.invoiceId());
      }
      text.append(": ").append(warning.message());
      document.add(new Paragraph(text.toString(), warningFont));
    }
  }

  // ==================== PDF HELPER METHODS ====================

  private void addReportTitle(Document document, String title) throws DocumentException {
    Paragraph name = new Paragraph(clinicName, TITLE_FONT);
    name.setAlignment(Element.ALIGN_CENTER);
    document.add(name);

    Paragraph reportTitle = new Paragraph(title, SECTION_FONT);
    reportTitle.setAlignment(Element.ALIGN_CENTER);
    reportTitle.setSpacingAfter(5);
    document.add(reportTitle);
  }

  private void addReportSubtitle(Document document, String text) throws DocumentException {
    Paragraph subtitle = new Paragraph(text, SUBTITLE_FONT);
    subtitle.setAlignment(Element.ALIGN_CENTER);
    subtitle.setSpacingAfter(15);
    document.add(subtitle);
  }

  private void addSectionHeader(Document document, String text) throws DocumentException {
    Paragraph section = new Paragraph(text, SECTION_FONT);
    section.setSpacingBefore(15);
    section.setSpacingAfter(8);
    document.add(section);
  }

  private void addReportFooter(Document document) throws DocumentException {
    document.add(Chunk.NEWLINE);
    document.add(Chunk.NEWLINE);
    Paragraph footer =
        new Paragraph(
            "Generated on " + LocalDate.now(clock).format(dateFormatter) + " by " + clinicName, SMALL_FONT);
    footer.setAlignment(Element.ALIGN_CENTER);
    document.add(footer);
  }

  private void addTableHeader(PdfPTable table, String text) {
    PdfPCell cell = new PdfPCell(new Phrase(text, TABLE_HEADER_FONT));
    cell.setBackgroundColor(HEADER_BG);
    cell.setPadding(8);
    cell.setHorizontalAlignment(Element.ALIGN_CENTER);
    table.addCell(cell);
  }

  private void addTableCell(PdfPTable table, String text, Color bgColor, int alignment) {
    PdfPCell cell = new PdfPCell(new Phrase(text, TABLE_CELL_FONT));
    cell.setBackgroundColor(bgColor);
    cell.setPadding(6);
    cell.setHorizontalAlignment(alignment);
    cell.setBorderColor(Color.LIGHT_GRAY);
    table.addCell(cell);
  }

  private void addTotalCell(PdfPTable table, String text) {
    PdfPCell cell = new PdfPCell(new Phrase(text, TABLE_CELL_BOLD));
    cell.setBackgroundColor(TOTAL_BG);
    cell.setPadding(8);
    cell.setHorizontalAlignment(Element.ALIGN_RIGHT);
    cell.setBorder(Rectangle.TOP);
    cell.setBorderWidth(2);
    table.addCell(cell);
  }

  private void addSummaryRow(PdfPTable table, String label, SectionTotals totals, Color bg) {
    addTableCell(table, label, bg, Element.ALIGN_LEFT);
    addTableCell(table, String.valueOf(totals.patientCount()), bg, Element.ALIGN_RIGHT);
    addTableCell(table, formatCurrency(totals.totalInvoiced()), bg, Element.ALIGN_RIGHT);
    addTableCell(table, formatCurrency(totals.paymentsReceived()), bg, Element.ALIGN_RIGHT);
    addTableCell(table, formatCurrency(totals.balance()), bg, Element.ALIGN_RIGHT);
  }

  /**
   * Amounts aged past the current bucket are shown in red.
   */
  private void addAgingCell(PdfPTable table, BigDecimal amount, Color bgColor, long daysOutstanding) {
    Color textColor = Color.BLACK;
    if (amount.compareTo(BigDecimal.ZERO) > 0 && daysOutstanding > 30) {
      textColor = OVERDUE_COLOR;
    }
    PdfPCell cell =
        new PdfPCell(
            new Phrase(
                formatCurrency(amount), new Font(Font.HELVETICA, 9, Font.NORMAL, textColor)));
    cell.setBackgroundColor(bgColor);
    cell.setPadding(6);
    cell.setHorizontalAlignment(Element.ALIGN_RIGHT);
    cell.setBorderColor(Color.LIGHT_GRAY);
    table.addCell(cell);
  }

  private void addLabelValue(PdfPTable table, String label, String value) {
    PdfPCell labelCell = new PdfPCell(new Phrase(label, TABLE_CELL_BOLD));
    labelCell.setBorder(Rectangle.NO_BORDER);
    labelCell.setPadding(3);
    table.addCell(labelCell);

    PdfPCell valueCell = new PdfPCell(new Phrase(value, TABLE_CELL_FONT));
    valueCell.setBorder(Rectangle.NO_BORDER);
    valueCell.setPadding(3);
    table.addCell(valueCell);
  }

  private void addAmountRow(PdfPTable table, String label, BigDecimal amount) {
    addTableCell(table, label, Color.WHITE, Element.ALIGN_LEFT);
    addTableCell(table, formatCurrency(amount), Color.WHITE, Element.ALIGN_RIGHT);
  }

  private void addGrandTotalRow(PdfPTable table, String label, BigDecimal amount) {
    PdfPCell labelCell = new PdfPCell(new Phrase(label, TOTAL_FONT));
    labelCell.setBorder(Rectangle.TOP);
    labelCell.setBorderWidth(2);
    labelCell.setPadding(10);
    labelCell.setBackgroundColor(TOTAL_BG);
    table.addCell(labelCell);

    PdfPCell amountCell = new PdfPCell(new Phrase(formatCurrency(amount), TOTAL_FONT));
    amountCell.setBorder(Rectangle.TOP);
    amountCell.setBorderWidth(2);
    amountCell.setPadding(10);
    amountCell.setHorizontalAlignment(Element.ALIGN_RIGHT);
    amountCell.setBackgroundColor(TOTAL_BG);
    table.addCell(amountCell);
  }

  // ==================== EXCEL HELPER METHODS ====================

  private void writeHeaderRow(Row row, String[] headers, CellStyle headerStyle) {
    for (int i = 0; i < headers.length; i++) {
      Cell cell = row.createCell(i);
      cell.setCellValue(headers[i]);
      cell.setCellStyle(headerStyle);
    }
  }

  // Fixed widths in characters; autoSizeColumn needs AWT fonts on the host
  private void setColumnWidths(Sheet sheet, int... widths) {
    for (int i = 0; i < widths.length; i++) {
      sheet.setColumnWidth(i, widths[i] * 256);
    }
  }

  private void setCurrency(Cell cell, BigDecimal amount, CellStyle style) {
    cell.setCellValue(amount.doubleValue());
    cell.setCellStyle(style);
  }

  private CellStyle createTitleStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    org.apache.poi.ss.usermodel.Font font = workbook.createFont();
    font.setBold(true);
    font.setFontHeightInPoints((short) 14);
    style.setFont(font);
    return style;
  }

  private CellStyle createHeaderStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    style.setFillForegroundColor(IndexedColors.DARK_BLUE.getIndex());
    style.setFillPattern(FillPatternType.SOLID_FOREGROUND);

    org.apache.poi.ss.usermodel.Font font = workbook.createFont();
    font.setBold(true);
    font.setColor(IndexedColors.WHITE.getIndex());
    style.setFont(font);

    style.setBorderBottom(BorderStyle.THIN);
    style.setBorderTop(BorderStyle.THIN);
    style.setBorderLeft(BorderStyle.THIN);
    style.setBorderRight(BorderStyle.THIN);

    return style;
  }

  private CellStyle createCurrencyStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    DataFormat format = workbook.createDataFormat();
    style.setDataFormat(format.getFormat("$#,##0.00"));
    return style;
  }

  private CellStyle createTotalStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    org.apache.poi.ss.usermodel.Font font = workbook.createFont();
    font.setBold(true);
    style.setFont(font);

    style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
    style.setFillPattern(FillPatternType.SOLID_FOREGROUND);

    style.setBorderTop(BorderStyle.DOUBLE);

    DataFormat format = workbook.createDataFormat();
    style.setDataFormat(format.getFormat("$#,##0.00"));

    return style;
  }

  // ==================== FORMATTING HELPERS ====================

  private String describeScope(Statement statement) {
    String asOf = "As of " + statement.asOfDate().format(dateFormatter);
    if (statement.periodStart() == null) {
      return "All outstanding invoices to " + statement.periodEnd().format(dateFormatter) + " - " + asOf;
    }
    return "Statement period " + statement.generatedScope() + " ("
        + statement.periodStart().format(dateFormatter) + " to "
        + statement.periodEnd().format(dateFormatter) + ") - " + asOf;
  }

  private String describeFlags(List<StatementWarning> warnings) {
    StringBuilder flags = new StringBuilder();
    for (StatementWarning warning : warnings) {
      if (flags.length() > 0) {
        flags.append("; ");
      }
      flags.append(warning.type());
    }
    return flags.toString();
  }

  private String invoiceLabel(InvoiceResult invoice) {
    return invoice.invoiceNumber() != null ? invoice.invoiceNumber() : "#" + invoice.invoiceId();
  }

  private String formatCurrency(BigDecimal amount) {
    if (amount == null) return currencyFormat.format(BigDecimal.ZERO);
    return currencyFormat.format(amount);
  }

  private static String nullToEmpty(String value) {
    return value != null ? value : "";
  }

  // ==================== CSV HELPER METHODS ====================

  /**
   * Escapes a field value for CSV output. Fields containing commas, quotes, or newlines are wrapped
   * in quotes, and embedded quotes are doubled.
   */
  private String escapeCsvField(String value) {
    if (value == null) return "";
    if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
