package io.b2mash.tms.tendering.exception;

import java.util.UUID;

/** A tender, offer, cascade or collaborator record that does not exist. */
public class ResourceNotFoundException extends TenderingException {

  private final String resourceType;
  private final Object resourceId;

  public ResourceNotFoundException(String resourceType, Object resourceId) {
    this(
        resourceType,
        resourceId,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + resourceId);
  }

  private ResourceNotFoundException(
      String resourceType, Object resourceId, String title, String detail) {
    super(TenderingErrorKind.NOT_FOUND, title, detail, null);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  /** The offer id exists on another tender, or not at all. */
  public static ResourceNotFoundException offerOnTender(UUID offerId, String tenderNumber) {
    return new ResourceNotFoundException(
        "Offer", offerId, "Offer not found", "No offer " + offerId + " on tender " + tenderNumber);
  }

  /** The carrier holds no offer on the tender. Resource id is the carrier id. */
  public static ResourceNotFoundException carrierOfferOnTender(UUID carrierId, String tenderNumber) {
    return new ResourceNotFoundException(
        "Offer",
        carrierId,
        "Offer not found",
        "No offer of carrier " + carrierId + " on tender " + tenderNumber);
  }

  /** The tender exists but does not head a cascade. */
  public static ResourceNotFoundException notCascadeRoot(UUID tenderId, String tenderNumber) {
    return new ResourceNotFoundException(
        "Cascade",
        tenderId,
        "Cascade not found",
        "Tender " + tenderNumber + " is not a cascade root");
  }

  public String getResourceType() {
    return resourceType;
  }

  public Object getResourceId() {
    return resourceId;
  }
}
