package io.b2mash.pms.invoice;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Billing endpoints. Every operation requires a billing role (madmin or admin). */
@RestController
@RequestMapping("/api/invoices")
@PreAuthorize("hasAnyRole('MADMIN', 'ADMIN')")
public class InvoiceController {

  private final InvoiceService invoiceService;

  public InvoiceController(InvoiceService invoiceService) {
    this.invoiceService = invoiceService;
  }

  @GetMapping
  public ResponseEntity<PagedResponse<InvoiceResponse>> listInvoices(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) UUID clientId,
      @RequestParam(required = false) UUID projectId,
      @RequestParam(required = false) String search,
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    var page =
        invoiceService.listInvoices(
            RequestScopes.requireCaller(),
            status != null ? InvoiceStatus.fromValue(status) : null,
            clientId,
            projectId,
            search,
            new PageWindow(limit, offset));
    LocalDate today = LocalDate.now();
    return ResponseEntity.ok(page.map(v -> InvoiceResponse.from(v, today)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable UUID id) {
    return ResponseEntity.ok(
        InvoiceResponse.from(
            invoiceService.getInvoice(RequestScopes.requireCaller(), id), LocalDate.now()));
  }

  @PostMapping
  public ResponseEntity<InvoiceResponse> createInvoice(
      @Valid @RequestBody CreateInvoiceRequest request) {
    var created =
        invoiceService.createInvoice(
            RequestScopes.requireCaller(),
            new InvoiceService.NewInvoice(
                request.clientId(),
                request.projectId(),
                request.amount(),
                request.description(),
                request.date(),
                request.dueDate()));
    return ResponseEntity.created(URI.create("/api/invoices/" + created.invoice().getId()))
        .body(InvoiceResponse.from(created, LocalDate.now()));
  }

  @PutMapping("/{id}")
  public ResponseEntity<InvoiceResponse> updateInvoice(
      @PathVariable UUID id, @Valid @RequestBody UpdateInvoiceRequest request) {
    var updated =
        invoiceService.updateInvoice(
            RequestScopes.requireCaller(),
            id,
            new InvoiceService.InvoiceChanges(
                request.clientId(),
                request.projectId(),
                request.amount(),
                request.description(),
                request.date(),
                request.dueDate(),
                request.status()));
    return ResponseEntity.ok(InvoiceResponse.from(updated, LocalDate.now()));
  }

  @PutMapping("/{id}/payment")
  public ResponseEntity<PaymentResponse> recordPayment(
      @PathVariable UUID id, @Valid @RequestBody PaymentRequest request) {
    boolean markAsPaid = Boolean.TRUE.equals(request.markAsPaid());
    var result =
        invoiceService.recordPayment(
            RequestScopes.requireCaller(), id, request.amount(), markAsPaid);
    return ResponseEntity.ok(
        new PaymentResponse(
            markAsPaid ? "Invoice marked as paid" : "Payment added successfully",
            InvoiceResponse.from(result.invoice(), LocalDate.now()),
            new PaymentSummary(result.amount(), result.newBalance(), result.totalPaid())));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteInvoice(@PathVariable UUID id) {
    invoiceService.deleteInvoice(RequestScopes.requireCaller(), id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/stats/overview")
  public ResponseEntity<InvoiceStats> getStats() {
    return ResponseEntity.ok(invoiceService.getStats(RequestScopes.requireCaller()));
  }

  @GetMapping("/export/csv")
  public ResponseEntity<byte[]> exportCsv(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate endDate) {
    var export =
        invoiceService.exportCsv(
            RequestScopes.requireCaller(),
            status != null ? InvoiceStatus.fromValue(status) : null,
            startDate,
            endDate);
    return ResponseEntity.ok()
        .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
        .header("Content-Disposition", "attachment; filename=\"" + export.filename() + "\"")
        .body(export.content());
  }

  // --- DTOs ---

  public record CreateInvoiceRequest(
      @NotNull(message = "clientId is required") UUID clientId,
      UUID projectId,
      @NotNull(message = "amount is required")
          @DecimalMin(value = "0.01", message = "amount must be a positive number")
          @Digits(integer = 12, fraction = 2, message = "amount must have at most 2 decimals")
          BigDecimal amount,
      @Size(max = 5000, message = "description must be at most 5000 characters")
          String description,
      @NotNull(message = "date is required") LocalDate date,
      @NotNull(message = "dueDate is required") LocalDate dueDate) {}

  public record UpdateInvoiceRequest(
      UUID clientId,
      UUID projectId,
      @DecimalMin(value = "0.01", message = "amount must be a positive number")
          @Digits(integer = 12, fraction = 2, message = "amount must have at most 2 decimals")
          BigDecimal amount,
      @Size(max = 5000, message = "description must be at most 5000 characters")
          String description,
      LocalDate date,
      LocalDate dueDate,
      InvoiceStatus status) {}

  public record PaymentRequest(
      @DecimalMin(value = "0.01", message = "Payment amount must be a positive number")
          @Digits(integer = 12, fraction = 2, message = "amount must have at most 2 decimals")
          BigDecimal amount,
      Boolean markAsPaid) {}

  public record PaymentSummary(BigDecimal amount, BigDecimal newBalance, BigDecimal totalPaid) {}

  public record PaymentResponse(String message, InvoiceResponse invoice, PaymentSummary payment) {}

  public record InvoiceResponse(
      UUID id,
      String invoiceNumber,
      UUID clientId,
      String clientName,
      String clientEmail,
      UUID projectId,
      String projectName,
      BigDecimal amount,
      BigDecimal paidAmount,
      BigDecimal balance,
      String description,
      LocalDate date,
      LocalDate dueDate,
      InvoiceStatus status,
      Instant createdAt,
      Instant updatedAt) {

    public static InvoiceResponse from(InvoiceView view, LocalDate today) {
      var invoice = view.invoice();
      return new InvoiceResponse(
          invoice.getId(),
          invoice.getInvoiceNumber(),
          invoice.getClientId(),
          view.clientName(),
          view.clientEmail(),
          invoice.getProjectId(),
          view.projectName(),
          invoice.getAmount(),
          invoice.getPaidAmount(),
          invoice.getBalance(),
          invoice.getDescription(),
          invoice.getInvoiceDate(),
          invoice.getDueDate(),
          invoice.effectiveStatus(today),
          invoice.getCreatedAt(),
          invoice.getUpdatedAt());
    }
  }
}
