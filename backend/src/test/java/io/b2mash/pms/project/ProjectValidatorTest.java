package io.b2mash.pms.project;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.pms.exception.ValidationException;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ProjectValidatorTest {

  private static final LocalDate START = LocalDate.of(2024, 3, 1);

  private final ProjectValidator validator = new ProjectValidator();

  @Test
  void endDateBeforeStartDateIsRejected() {
    assertThatThrownBy(
            () ->
                validator.validate(
                    START, START.minusDays(1), ProjectStatus.COMPLETED, true, true))
        .isInstanceOf(ValidationException.class)
        .hasFieldOrPropertyWithValue("field", "endDate")
        .hasFieldOrPropertyWithValue("constraint", "date_order");
  }

  @Test
  void endDateEqualToStartDateIsAccepted() {
    assertThatCode(() -> validator.validate(START, START, ProjectStatus.COMPLETED, true, false))
        .doesNotThrowAnyException();
  }

  @Test
  void userCannotSetEndDateOnUnfinishedProject() {
    assertThatThrownBy(
            () ->
                validator.validate(
                    START, START.plusDays(10), ProjectStatus.ONGOING, true, false))
        .isInstanceOf(ValidationException.class)
        .hasFieldOrPropertyWithValue("constraint", "end_date_requires_completed");
  }

  @Test
  void privilegedCallerMaySetEndDateOnAnyStatus() {
    assertThatCode(
            () ->
                validator.validate(START, START.plusDays(10), ProjectStatus.PENDING, true, true))
        .doesNotThrowAnyException();
  }

  @Test
  void existingEndDateIsNotReCheckedAgainstStatusWhenNotSupplied() {
    assertThatCode(
            () ->
                validator.validate(
                    START, START.plusDays(10), ProjectStatus.ONGOING, false, false))
        .doesNotThrowAnyException();
  }
}
