package io.b2mash.tms.tendering.exception;

/** The request collides with what is already recorded, such as a second accepted offer. */
public class ResourceConflictException extends TenderingException {

  public ResourceConflictException(String title, String detail) {
    super(TenderingErrorKind.CONFLICT, title, detail, null);
  }

  public static ResourceConflictException offerAlreadyAccepted(String tenderNumber) {
    return new ResourceConflictException(
        "Offer already accepted", "Tender " + tenderNumber + " already has an accepted offer");
  }
}
