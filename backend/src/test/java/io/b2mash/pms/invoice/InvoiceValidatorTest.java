package io.b2mash.pms.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.b2mash.pms.exception.ResourceNotFoundException;
import io.b2mash.pms.exception.ValidationException;
import io.b2mash.pms.project.ProjectRepository;
import io.b2mash.pms.security.RoleSet;
import io.b2mash.pms.user.User;
import io.b2mash.pms.user.UserRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InvoiceValidatorTest {

  @Mock private UserRepository userRepository;
  @Mock private ProjectRepository projectRepository;
  @InjectMocks private InvoiceValidator validator;

  @Test
  void missingClientIsNotFound() {
    var id = UUID.randomUUID();
    when(userRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> validator.requireBillableClient(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void unapprovedClientIsRejected() {
    var id = UUID.randomUUID();
    var client = new User("c@example.com", "client", "Client", "hash", RoleSet.staffOnly(), false);
    when(userRepository.findById(id)).thenReturn(Optional.of(client));

    assertThatThrownBy(() -> validator.requireBillableClient(id))
        .isInstanceOf(ValidationException.class)
        .hasFieldOrPropertyWithValue("field", "clientId")
        .hasFieldOrPropertyWithValue("constraint", "client_not_approved");
  }

  @Test
  void approvedClientIsReturned() {
    var id = UUID.randomUUID();
    var client = new User("c@example.com", "client", "Client", "hash", RoleSet.staffOnly(), true);
    when(userRepository.findById(id)).thenReturn(Optional.of(client));

    assertThat(validator.requireBillableClient(id)).isSameAs(client);
  }

  @Test
  void unknownProjectIsNotFound() {
    var id = UUID.randomUUID();
    when(projectRepository.existsById(id)).thenReturn(false);

    assertThatThrownBy(() -> validator.requireProject(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void dueDateBeforeInvoiceDateIsRejected() {
    var date = LocalDate.of(2024, 6, 1);

    assertThatThrownBy(() -> validator.validateDates(date, date.minusDays(1)))
        .isInstanceOf(ValidationException.class)
        .hasFieldOrPropertyWithValue("field", "dueDate");
    assertThatCode(() -> validator.validateDates(date, date)).doesNotThrowAnyException();
  }

  @Test
  void amountBelowPaidAmountIsRejected() {
    assertThatThrownBy(
            () -> validator.validateAmountCoversPaid(new BigDecimal("50"), new BigDecimal("60")))
        .isInstanceOf(ValidationException.class)
        .hasFieldOrPropertyWithValue("constraint", "below_paid_amount");
  }
}
