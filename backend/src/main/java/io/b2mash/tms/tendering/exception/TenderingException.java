package io.b2mash.tms.tendering.exception;

import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base of every tendering failure. The HTTP status follows from the {@link TenderingErrorKind}, and
 * the problem body carries the title, the detail and the kind.
 */
public abstract class TenderingException extends ErrorResponseException {

  public static final String KIND_PROPERTY = "kind";

  private final TenderingErrorKind kind;

  protected TenderingException(
      TenderingErrorKind kind, String title, String detail, Throwable cause) {
    super(kind.status(), problem(kind, title, detail), cause);
    this.kind = kind;
  }

  public TenderingErrorKind getKind() {
    return kind;
  }

  private static ProblemDetail problem(TenderingErrorKind kind, String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(kind.status(), detail);
    problem.setTitle(title);
    problem.setProperty(KIND_PROPERTY, kind.name());
    return problem;
  }
}
