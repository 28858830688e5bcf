package io.b2mash.tms.tendering.tender.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Payload of the offer-submit pre hook. Handlers may rewrite price, validity and conditions. */
public record OfferSubmission(
    UUID tenderId,
    UUID carrierId,
    BigDecimal priceAmount,
    String priceCurrency,
    Instant validUntil,
    List<String> conditions) {

  public static OfferSubmission of(UUID tenderId, UUID carrierId, SubmitOfferRequest request) {
    return new OfferSubmission(
        tenderId,
        carrierId,
        request.priceAmount(),
        request.priceCurrency(),
        request.validUntil(),
        request.conditions() != null ? List.copyOf(request.conditions()) : List.of());
  }
}
