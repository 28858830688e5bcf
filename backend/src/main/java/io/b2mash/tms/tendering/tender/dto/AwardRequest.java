package io.b2mash.tms.tendering.tender.dto;

import java.math.BigDecimal;
import java.util.UUID;

/** Payload of the tender-award pre hook. Only a veto has an effect. */
public record AwardRequest(
    UUID tenderId,
    String tenderNumber,
    UUID offerId,
    UUID carrierId,
    BigDecimal priceAmount,
    String priceCurrency) {}
