package io.b2mash.tms.tendering.event;

import io.b2mash.tms.tendering.tender.OfferStatus;
import io.b2mash.tms.tendering.tender.TenderOffer;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record OfferEvent(
    TenderEventType type,
    UUID offerId,
    UUID tenderId,
    UUID carrierId,
    OfferStatus status,
    BigDecimal priceAmount,
    String priceCurrency,
    Instant occurredAt)
    implements TenderDomainEvent {

  public static OfferEvent of(TenderEventType type, TenderOffer offer) {
    if (!"offer".equals(type.entityType())) {
      throw new IllegalArgumentException(type + " is not an offer event");
    }
    return new OfferEvent(
        type,
        offer.getId(),
        offer.getTenderId(),
        offer.getCarrierId(),
        offer.getStatus(),
        offer.getPriceAmount(),
        offer.getPriceCurrency(),
        Instant.now());
  }

  @Override
  public UUID entityId() {
    return offerId;
  }

  @Override
  public Map<String, Object> details() {
    var details = new LinkedHashMap<String, Object>();
    details.put("tender_id", tenderId.toString());
    details.put("carrier_id", carrierId.toString());
    details.put("status", status.name());
    details.put("price_amount", priceAmount.toPlainString());
    details.put("price_currency", priceCurrency);
    return details;
  }
}
