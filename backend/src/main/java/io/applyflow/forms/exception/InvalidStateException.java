package io.applyflow.forms.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A request that would leave a form definition structurally invalid. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, List.of()), null);
  }

  /** Carries one message per problem found, exposed as the {@code violations} property. */
  public InvalidStateException(String title, String detail, List<String> violations) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, violations), null);
  }

  @SuppressWarnings("unchecked")
  public List<String> getViolations() {
    var properties = getBody().getProperties();
    if (properties == null || !(properties.get("violations") instanceof List<?> list)) {
      return List.of();
    }
    return (List<String>) list;
  }

  private static ProblemDetail createProblem(String title, String detail, List<String> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (!violations.isEmpty()) {
      problem.setProperty("violations", List.copyOf(violations));
    }
    return problem;
  }
}
