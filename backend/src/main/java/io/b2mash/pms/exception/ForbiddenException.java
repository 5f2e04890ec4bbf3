package io.b2mash.pms.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ForbiddenException extends ErrorResponseException {

  private final String reason;

  public ForbiddenException(String title, String detail) {
    this(title, detail, null);
  }

  public ForbiddenException(String title, String detail, String reason) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail, reason), null);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }

  private static ProblemDetail createProblem(String title, String detail, String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (reason != null) {
      problem.setProperty("reason", reason);
    }
    return problem;
  }
}
