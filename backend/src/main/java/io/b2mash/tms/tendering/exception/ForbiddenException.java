package io.b2mash.tms.tendering.exception;

import java.util.UUID;

/** Raised when a carrier acts on a tender it was not invited to. */
public class ForbiddenException extends TenderingException {

  private final UUID carrierId;

  public ForbiddenException(UUID carrierId, String tenderNumber) {
    super(
        TenderingErrorKind.FORBIDDEN,
        "Carrier not invited",
        "Carrier " + carrierId + " was not invited to tender " + tenderNumber,
        null);
    this.carrierId = carrierId;
  }

  public UUID getCarrierId() {
    return carrierId;
  }
}
