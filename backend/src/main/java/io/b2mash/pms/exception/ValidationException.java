package io.b2mash.pms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Malformed or rule-violating input. Carries the offending field and the broken constraint. */
public class ValidationException extends ErrorResponseException {

  private final String field;
  private final String constraint;

  public ValidationException(String field, String constraint, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(field, constraint, detail), null);
    this.field = field;
    this.constraint = constraint;
  }

  public String getField() {
    return field;
  }

  public String getConstraint() {
    return constraint;
  }

  private static ProblemDetail createProblem(String field, String constraint, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(detail);
    if (field != null) {
      problem.setProperty("field", field);
    }
    problem.setProperty("constraint", constraint);
    return problem;
  }
}
