package io.b2mash.pms.invoice;

import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/** Renders invoice rows as RFC 4180 CSV with a header line. */
@Component
public class InvoiceCsvExporter {

  static final List<String> HEADERS =
      List.of(
          "Invoice Number",
          "Date",
          "Due Date",
          "Amount",
          "Paid Amount",
          "Balance",
          "Status",
          "Client Name",
          "Client Email",
          "Project",
          "Description");

  public byte[] render(List<InvoiceView> rows, LocalDate today) {
    var out = new ByteArrayOutputStream();
    try (var writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
      writer.write(HEADERS.stream().map(this::escapeCsv).collect(Collectors.joining(",")));
      writer.newLine();

      for (var row : rows) {
        var invoice = row.invoice();
        writer.write(
            Stream.of(
                    invoice.getInvoiceNumber(),
                    invoice.getInvoiceDate().toString(),
                    invoice.getDueDate().toString(),
                    money(invoice.getAmount()),
                    money(invoice.getPaidAmount()),
                    money(invoice.getBalance()),
                    invoice.effectiveStatus(today).value(),
                    row.clientName(),
                    row.clientEmail(),
                    row.projectName(),
                    invoice.getDescription())
                .map(this::escapeCsv)
                .collect(Collectors.joining(",")));
        writer.newLine();
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to render invoice CSV", e);
    }
    return out.toByteArray();
  }

  public String filename(LocalDate today) {
    return "invoices_export_" + today + ".csv";
  }

  private String money(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    // Defuse CSV formula injection (OWASP recommendation)
    if (!value.isEmpty() && "=+-@\t\r".indexOf(value.charAt(0)) >= 0) {
      value = "'" + value;
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
