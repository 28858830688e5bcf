package io.b2mash.tms.tendering.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced by tendering operations. The name is written to the {@code kind}
 * property of every problem body so callers can branch without parsing titles.
 */
public enum TenderingErrorKind {
  NOT_FOUND(HttpStatus.NOT_FOUND),
  INVALID_STATE(HttpStatus.BAD_REQUEST),
  FORBIDDEN(HttpStatus.FORBIDDEN),
  DEADLINE_PASSED(HttpStatus.UNPROCESSABLE_ENTITY),
  CONFLICT(HttpStatus.CONFLICT),
  VETOED_BY_POLICY(HttpStatus.UNPROCESSABLE_ENTITY),
  CASCADE_ESCALATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus status;

  TenderingErrorKind(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
