package io.b2mash.tms.tendering.tender.dto;

import io.b2mash.tms.tendering.tender.OfferStatus;
import io.b2mash.tms.tendering.tender.TenderOffer;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record OfferResponse(
    UUID id,
    UUID tenderId,
    UUID carrierId,
    OfferStatus status,
    BigDecimal priceAmount,
    String priceCurrency,
    Instant validUntil,
    List<String> conditions,
    Instant submittedAt,
    Instant decidedAt) {

  public static OfferResponse from(TenderOffer offer) {
    return new OfferResponse(
        offer.getId(),
        offer.getTenderId(),
        offer.getCarrierId(),
        offer.getStatus(),
        offer.getPriceAmount(),
        offer.getPriceCurrency(),
        offer.getValidUntil(),
        offer.getConditions(),
        offer.getSubmittedAt(),
        offer.getDecidedAt());
  }
}
