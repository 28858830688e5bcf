package io.b2mash.tms.tendering.exception;

import java.util.UUID;

/**
 * Raised when opening the next tier of a sequential cascade fails while reacting to a tier
 * closing. The triggering transaction rolls back so the closed tier is retried by the next sweep.
 */
public class CascadeEscalationException extends TenderingException {

  private final UUID tenderId;

  public CascadeEscalationException(UUID tenderId, Throwable cause) {
    super(
        TenderingErrorKind.CASCADE_ESCALATION_FAILED,
        "Cascade escalation failed",
        "Could not escalate cascade after tender "
            + tenderId
            + " closed: "
            + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()),
        cause);
    this.tenderId = tenderId;
  }

  public UUID getTenderId() {
    return tenderId;
  }
}
