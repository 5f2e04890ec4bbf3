package io.b2mash.pms.invoice;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.exception.ResourceConflictException;
import io.b2mash.pms.exception.ResourceNotFoundException;
import io.b2mash.pms.exception.ValidationException;
import io.b2mash.pms.project.Project;
import io.b2mash.pms.project.ProjectRepository;
import io.b2mash.pms.security.AccessPolicy;
import io.b2mash.pms.security.Caller;
import io.b2mash.pms.user.User;
import io.b2mash.pms.user.UserRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InvoiceService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

  private final InvoiceRepository invoiceRepository;
  private final InvoiceListQuery invoiceListQuery;
  private final InvoiceNumberService invoiceNumberService;
  private final InvoiceValidator invoiceValidator;
  private final InvoiceCsvExporter csvExporter;
  private final UserRepository userRepository;
  private final ProjectRepository projectRepository;
  private final AccessPolicy accessPolicy;

  public InvoiceService(
      InvoiceRepository invoiceRepository,
      InvoiceListQuery invoiceListQuery,
      InvoiceNumberService invoiceNumberService,
      InvoiceValidator invoiceValidator,
      InvoiceCsvExporter csvExporter,
      UserRepository userRepository,
      ProjectRepository projectRepository,
      AccessPolicy accessPolicy) {
    this.invoiceRepository = invoiceRepository;
    this.invoiceListQuery = invoiceListQuery;
    this.invoiceNumberService = invoiceNumberService;
    this.invoiceValidator = invoiceValidator;
    this.csvExporter = csvExporter;
    this.userRepository = userRepository;
    this.projectRepository = projectRepository;
    this.accessPolicy = accessPolicy;
  }

  public record NewInvoice(
      UUID clientId,
      UUID projectId,
      BigDecimal amount,
      String description,
      LocalDate invoiceDate,
      LocalDate dueDate) {}

  /** Partial update. Null means "not supplied". */
  public record InvoiceChanges(
      UUID clientId,
      UUID projectId,
      BigDecimal amount,
      String description,
      LocalDate invoiceDate,
      LocalDate dueDate,
      InvoiceStatus status) {}

  /**
   * @param amount the amount applied by this payment
   * @param newBalance remaining balance after the payment
   * @param totalPaid paid amount after the payment
   */
  public record PaymentResult(
      InvoiceView invoice, BigDecimal amount, BigDecimal newBalance, BigDecimal totalPaid) {}

  public record CsvExport(byte[] content, String filename) {}

  @Transactional(readOnly = true)
  public PagedResponse<InvoiceView> listInvoices(
      Caller caller,
      InvoiceStatus status,
      UUID clientId,
      UUID projectId,
      String search,
      PageWindow window) {
    accessPolicy.billing(caller).orThrow();
    var filter = new InvoiceListQuery.Filter(status, clientId, projectId, search, null, null);
    return invoiceListQuery.page(filter, LocalDate.now(), window);
  }

  @Transactional(readOnly = true)
  public InvoiceView getInvoice(Caller caller, UUID id) {
    accessPolicy.billing(caller).orThrow();
    return view(requireInvoice(id));
  }

  @Transactional
  public InvoiceView createInvoice(Caller caller, NewInvoice request) {
    accessPolicy.billing(caller).orThrow();
    requirePositive(request.amount());
    invoiceValidator.requireBillableClient(request.clientId());
    if (request.projectId() != null) {
      invoiceValidator.requireProject(request.projectId());
    }
    invoiceValidator.validateDates(request.invoiceDate(), request.dueDate());

    String number = invoiceNumberService.reserveNumber(request.invoiceDate().getYear());
    var invoice =
        new Invoice(
            number,
            request.clientId(),
            request.projectId(),
            request.amount(),
            request.description(),
            request.invoiceDate(),
            request.dueDate());
    try {
      invoice = invoiceRepository.saveAndFlush(invoice);
    } catch (DataIntegrityViolationException e) {
      log.warn("Invoice number {} collided: {}", number, e.getMessage());
      throw new ResourceConflictException(
          "duplicate", "Duplicate invoice number", "Invoice number " + number + " already exists");
    }
    log.info("Created invoice {} ({}) by user {}", invoice.getId(), number, caller.userId());
    return view(invoice);
  }

  @Transactional
  public InvoiceView updateInvoice(Caller caller, UUID id, InvoiceChanges changes) {
    accessPolicy.billing(caller).orThrow();
    var invoice = requireInvoice(id);

    if (changes.amount() != null) {
      requirePositive(changes.amount());
      invoiceValidator.validateAmountCoversPaid(changes.amount(), invoice.getPaidAmount());
    }
    if (changes.clientId() != null) {
      invoiceValidator.requireBillableClient(changes.clientId());
    }
    if (changes.projectId() != null) {
      invoiceValidator.requireProject(changes.projectId());
    }
    invoiceValidator.validateDates(
        changes.invoiceDate() != null ? changes.invoiceDate() : invoice.getInvoiceDate(),
        changes.dueDate() != null ? changes.dueDate() : invoice.getDueDate());

    invoice.update(
        changes.clientId(),
        changes.projectId(),
        changes.amount(),
        changes.description(),
        changes.invoiceDate(),
        changes.dueDate(),
        changes.status());
    invoice = invoiceRepository.save(invoice);
    log.info("Updated invoice {} by user {}", id, caller.userId());
    return view(invoice);
  }

  /**
   * Records a partial payment, or settles the invoice in full when {@code markAsPaid} is set.
   * Rejected payments leave the invoice unchanged.
   */
  @Transactional
  public PaymentResult recordPayment(
      Caller caller, UUID id, BigDecimal amount, boolean markAsPaid) {
    accessPolicy.billing(caller).orThrow();
    var invoice = requireInvoice(id);
    BigDecimal paidBefore = invoice.getPaidAmount();

    if (markAsPaid) {
      invoice.markAsPaid();
    } else {
      requirePositive(amount);
      invoice.recordPayment(amount);
    }
    invoice = invoiceRepository.save(invoice);
    log.info(
        "Recorded payment on invoice {}: paid {} of {} by user {}",
        id,
        invoice.getPaidAmount(),
        invoice.getAmount(),
        caller.userId());

    return new PaymentResult(
        view(invoice),
        invoice.getPaidAmount().subtract(paidBefore),
        invoice.getBalance(),
        invoice.getPaidAmount());
  }

  @Transactional
  public void deleteInvoice(Caller caller, UUID id) {
    accessPolicy.billing(caller).orThrow();
    accessPolicy.invoiceDelete(caller).orThrow();
    var invoice = requireInvoice(id);
    invoiceRepository.delete(invoice);
    log.info(
        "Deleted invoice {} ({}) by user {}", id, invoice.getInvoiceNumber(), caller.userId());
  }

  @Transactional(readOnly = true)
  public InvoiceStats getStats(Caller caller) {
    accessPolicy.billing(caller).orThrow();
    return InvoiceStats.from(invoiceRepository.computeStats(LocalDate.now()));
  }

  @Transactional(readOnly = true)
  public CsvExport exportCsv(
      Caller caller, InvoiceStatus status, LocalDate startDate, LocalDate endDate) {
    accessPolicy.billing(caller).orThrow();
    LocalDate today = LocalDate.now();
    var rows =
        invoiceListQuery.all(InvoiceListQuery.Filter.forExport(status, startDate, endDate), today);
    log.info("Exporting {} invoices to CSV for user {}", rows.size(), caller.userId());
    return new CsvExport(csvExporter.render(rows, today), csvExporter.filename(today));
  }

  private Invoice requireInvoice(UUID id) {
    return invoiceRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", id));
  }

  private void requirePositive(BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new ValidationException("amount", "positive", "Amount must be a positive number");
    }
  }

  private InvoiceView view(Invoice invoice) {
    var client = userRepository.findById(invoice.getClientId());
    String projectName =
        invoice.getProjectId() != null
            ? projectRepository.findById(invoice.getProjectId()).map(Project::getName).orElse(null)
            : null;
    return new InvoiceView(
        invoice,
        client.map(User::getName).orElse(null),
        client.map(User::getEmail).orElse(null),
        projectName);
  }
}
