package io.b2mash.pms.invoice;

import io.b2mash.pms.exception.ResourceNotFoundException;
import io.b2mash.pms.exception.ValidationException;
import io.b2mash.pms.project.ProjectRepository;
import io.b2mash.pms.user.User;
import io.b2mash.pms.user.UserRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Reference and date checks for invoice writes. */
@Component
public class InvoiceValidator {

  private final UserRepository userRepository;
  private final ProjectRepository projectRepository;

  public InvoiceValidator(UserRepository userRepository, ProjectRepository projectRepository) {
    this.userRepository = userRepository;
    this.projectRepository = projectRepository;
  }

  /** The client must exist and be approved. */
  public User requireBillableClient(UUID clientId) {
    var client =
        userRepository
            .findById(clientId)
            .orElseThrow(() -> new ResourceNotFoundException("Client", clientId));
    if (!client.isApproved()) {
      throw new ValidationException(
          "clientId", "client_not_approved", "Client must be an approved user");
    }
    return client;
  }

  public void requireProject(UUID projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
  }

  /** Lowering the amount below what has already been paid is rejected. */
  public void validateAmountCoversPaid(BigDecimal amount, BigDecimal paidAmount) {
    if (amount.compareTo(paidAmount) < 0) {
      throw new ValidationException(
          "amount", "below_paid_amount", "Amount cannot be less than the amount already paid");
    }
  }

  public void validateDates(LocalDate invoiceDate, LocalDate dueDate) {
    if (invoiceDate != null && dueDate != null && dueDate.isBefore(invoiceDate)) {
      throw new ValidationException(
          "dueDate", "date_order", "Due date cannot be before invoice date");
    }
  }
}
