package io.b2mash.tms.tendering.exception;

/**
 * Raised when a pre-transition hook handler rejects an operation. The handler's reason is carried
 * verbatim as the problem detail.
 */
public class PolicyVetoException extends TenderingException {

  private final String hookId;
  private final String reason;

  public PolicyVetoException(String hookId, String reason) {
    this(hookId, reason, null);
  }

  /** Veto raised because a handler threw; the handler's exception is kept as the cause. */
  public PolicyVetoException(String hookId, String reason, Throwable cause) {
    super(TenderingErrorKind.VETOED_BY_POLICY, "Vetoed by policy", reason, cause);
    this.hookId = hookId;
    this.reason = reason;
  }

  public String getHookId() {
    return hookId;
  }

  public String getReason() {
    return reason;
  }
}
