package io.b2mash.pms.project;

import io.b2mash.pms.exception.ValidationException;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/** Date and end-date rules applied to the values a project would hold after a write. */
@Component
public class ProjectValidator {

  /**
   * @param startDate resulting start date
   * @param endDate resulting end date, may be null
   * @param status resulting status
   * @param endDateSupplied whether this write sets the end date
   * @param privileged whether the writer holds a privileged role
   */
  public void validate(
      LocalDate startDate,
      LocalDate endDate,
      ProjectStatus status,
      boolean endDateSupplied,
      boolean privileged) {
    if (endDate != null && startDate != null && endDate.isBefore(startDate)) {
      throw new ValidationException(
          "endDate", "date_order", "End date cannot be before start date");
    }
    if (!privileged && endDateSupplied && status != ProjectStatus.COMPLETED) {
      throw new ValidationException(
          "endDate",
          "end_date_requires_completed",
          "End date can only be set when project status is completed");
    }
  }
}
