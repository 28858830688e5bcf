package io.b2mash.tms.tendering.exception;

/**
 * A transition or input that the current state of a tender or offer does not allow. Status guards
 * use {@link #forStatus}; other rule breaches pass their own title.
 */
public class InvalidStateException extends TenderingException {

  public InvalidStateException(String title, String detail) {
    super(TenderingErrorKind.INVALID_STATE, title, detail, null);
  }

  /**
   * Guard failure on a status check, worded as "Cannot {action} {subject} in status {status}".
   *
   * @param subject "tender" or "offer"
   */
  public static InvalidStateException forStatus(String subject, String action, Enum<?> status) {
    return new InvalidStateException(
        "Invalid " + subject + " state",
        "Cannot " + action + " " + subject + " in status " + status);
  }
}
