package io.b2mash.tms.tendering.exception;

import java.time.Instant;
import java.util.UUID;

/** Raised when an offer is submitted after the tender's offer deadline. */
public class DeadlinePassedException extends TenderingException {

  private final UUID tenderId;
  private final Instant offerDeadline;

  public DeadlinePassedException(UUID tenderId, Instant offerDeadline) {
    super(
        TenderingErrorKind.DEADLINE_PASSED,
        "Offer deadline passed",
        "Tender " + tenderId + " stopped accepting offers at " + offerDeadline,
        null);
    this.tenderId = tenderId;
    this.offerDeadline = offerDeadline;
  }

  public UUID getTenderId() {
    return tenderId;
  }

  public Instant getOfferDeadline() {
    return offerDeadline;
  }
}
