package io.b2mash.tms.tendering.tender.dto;

import io.b2mash.tms.tendering.tender.Tender;
import io.b2mash.tms.tendering.tender.TenderMode;
import io.b2mash.tms.tendering.tender.TenderOffer;
import io.b2mash.tms.tendering.tender.TenderStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TenderResponse(
    UUID id,
    String tenderNumber,
    UUID orderId,
    UUID shipmentId,
    UUID brokerId,
    TenderStatus status,
    TenderMode mode,
    int tier,
    UUID parentTenderId,
    UUID cascadeRootId,
    Instant offerDeadline,
    UUID awardedOfferId,
    UUID awardedCarrierId,
    Instant openedAt,
    Instant closedAt,
    Instant awardedAt,
    Instant cancelledAt,
    String cancelReason,
    Instant createdAt,
    List<OfferResponse> offers) {

  public static TenderResponse from(Tender tender, List<TenderOffer> offers) {
    return new TenderResponse(
        tender.getId(),
        tender.getTenderNumber(),
        tender.getOrderId(),
        tender.getShipmentId(),
        tender.getBrokerId(),
        tender.getStatus(),
        tender.getMode(),
        tender.getTier(),
        tender.getParentTenderId(),
        tender.getCascadeRootId(),
        tender.getOfferDeadline(),
        tender.getAwardedOfferId(),
        tender.getAwardedCarrierId(),
        tender.getOpenedAt(),
        tender.getClosedAt(),
        tender.getAwardedAt(),
        tender.getCancelledAt(),
        tender.getCancelReason(),
        tender.getCreatedAt(),
        offers.stream().map(OfferResponse::from).toList());
  }

  /** Offer placed by {@code carrierId}, if the carrier was invited. */
  public OfferResponse offerOf(UUID carrierId) {
    return offers.stream().filter(o -> o.carrierId().equals(carrierId)).findFirst().orElse(null);
  }
}
