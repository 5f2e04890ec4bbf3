package io.b2mash.pms.invoice;

import io.b2mash.pms.exception.ResourceConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Invoice issued to an approved client, optionally against a project.
 *
 * <p>Payments accumulate in {@code paidAmount}, which never exceeds {@code amount}. The stored
 * status is one of pending, paid or cancelled (overdue only when set explicitly); a pending invoice
 * past its due date is reported as overdue by {@link #effectiveStatus(LocalDate)} without being
 * rewritten.
 */
@Entity
@Table(name = "invoices")
public class Invoice {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invoice_number", nullable = false, length = 20, updatable = false)
  private String invoiceNumber;

  @Column(name = "client_id", nullable = false)
  private UUID clientId;

  @Column(name = "project_id")
  private UUID projectId;

  @Column(name = "amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal amount;

  @Column(name = "paid_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal paidAmount;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "invoice_date", nullable = false)
  private LocalDate invoiceDate;

  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Invoice() {}

  public Invoice(
      String invoiceNumber,
      UUID clientId,
      UUID projectId,
      BigDecimal amount,
      String description,
      LocalDate invoiceDate,
      LocalDate dueDate) {
    this.invoiceNumber = invoiceNumber;
    this.clientId = clientId;
    this.projectId = projectId;
    this.amount = amount.setScale(2, RoundingMode.HALF_UP);
    this.paidAmount = BigDecimal.ZERO.setScale(2);
    this.description = description;
    this.invoiceDate = invoiceDate;
    this.dueDate = dueDate;
    this.status = InvoiceStatus.PENDING;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Status as reported to clients: a pending invoice past its due date is overdue. */
  public InvoiceStatus effectiveStatus(LocalDate today) {
    if (status == InvoiceStatus.PENDING && dueDate.isBefore(today)) {
      return InvoiceStatus.OVERDUE;
    }
    return status;
  }

  public BigDecimal getBalance() {
    return amount.subtract(paidAmount);
  }

  /**
   * Adds a partial payment. The invoice becomes paid once the total reaches the amount.
   *
   * @throws ResourceConflictException if the invoice is cancelled or the payment exceeds the
   *     remaining balance; the invoice is left unchanged
   */
  public void recordPayment(BigDecimal payment) {
    requireNotCancelled();
    BigDecimal newPaid = paidAmount.add(payment).setScale(2, RoundingMode.HALF_UP);
    if (newPaid.compareTo(amount) > 0) {
      throw new ResourceConflictException(
          "payment_exceeds_balance",
          "Payment exceeds balance",
          "Payment amount exceeds remaining balance. Remaining: $"
              + getBalance().setScale(2, RoundingMode.HALF_UP).toPlainString());
    }
    this.paidAmount = newPaid;
    this.status = newPaid.compareTo(amount) >= 0 ? InvoiceStatus.PAID : InvoiceStatus.PENDING;
    this.updatedAt = Instant.now();
  }

  /**
   * Settles the invoice in full regardless of earlier partial payments.
   *
   * @throws ResourceConflictException if the invoice is cancelled
   */
  public void markAsPaid() {
    requireNotCancelled();
    this.paidAmount = amount;
    this.status = InvoiceStatus.PAID;
    this.updatedAt = Instant.now();
  }

  /**
   * Applies supplied fields; nulls leave the current value in place. The resulting status always
   * agrees with the balance: paid exactly when the paid amount covers the amount, unless the
   * invoice is cancelled.
   *
   * @throws ResourceConflictException if the requested status contradicts the balance; the invoice
   *     is left unchanged
   */
  public void update(
      UUID clientId,
      UUID projectId,
      BigDecimal amount,
      String description,
      LocalDate invoiceDate,
      LocalDate dueDate,
      InvoiceStatus status) {
    BigDecimal newAmount =
        amount != null ? amount.setScale(2, RoundingMode.HALF_UP) : this.amount;
    InvoiceStatus newStatus = resolveStatus(status, newAmount);

    if (clientId != null) {
      this.clientId = clientId;
    }
    if (projectId != null) {
      this.projectId = projectId;
    }
    if (description != null) {
      this.description = description;
    }
    if (invoiceDate != null) {
      this.invoiceDate = invoiceDate;
    }
    if (dueDate != null) {
      this.dueDate = dueDate;
    }
    this.amount = newAmount;
    this.status = newStatus;
    this.updatedAt = Instant.now();
  }

  private InvoiceStatus resolveStatus(InvoiceStatus requested, BigDecimal newAmount) {
    boolean settled = paidAmount.compareTo(newAmount) >= 0;
    if (requested == null) {
      if (status == InvoiceStatus.CANCELLED) {
        return status;
      }
      if (settled) {
        return InvoiceStatus.PAID;
      }
      return status == InvoiceStatus.PAID ? InvoiceStatus.PENDING : status;
    }
    return switch (requested) {
      case CANCELLED -> InvoiceStatus.CANCELLED;
      case PAID -> {
        if (!settled) {
          throw new ResourceConflictException(
              "balance_outstanding",
              "Balance outstanding",
              "Invoice has an outstanding balance of $"
                  + newAmount.subtract(paidAmount).toPlainString()
                  + ". Record a payment or mark it as paid.");
        }
        yield InvoiceStatus.PAID;
      }
      case PENDING, OVERDUE -> {
        if (settled) {
          throw new ResourceConflictException(
              "fully_paid",
              "Invoice fully paid",
              "A fully paid invoice cannot be set to " + requested.value());
        }
        yield requested;
      }
    };
  }

  private void requireNotCancelled() {
    if (status == InvoiceStatus.CANCELLED) {
      throw new ResourceConflictException(
          "invoice_cancelled", "Invoice cancelled", "Cannot add payment to cancelled invoice");
    }
  }

  public UUID getId() {
    return id;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public UUID getClientId() {
    return clientId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public BigDecimal getPaidAmount() {
    return paidAmount;
  }

  public String getDescription() {
    return description;
  }

  public LocalDate getInvoiceDate() {
    return invoiceDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
