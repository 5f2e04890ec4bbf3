package io.b2mash.pms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The request is well-formed but the target's current state does not permit it, for example
 * completing an already completed project or clocking in twice.
 */
public class ResourceConflictException extends ErrorResponseException {

  private final String condition;

  public ResourceConflictException(String condition, String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(condition, title, detail), null);
    this.condition = condition;
  }

  public String getCondition() {
    return condition;
  }

  private static ProblemDetail createProblem(String condition, String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("condition", condition);
    return problem;
  }
}
