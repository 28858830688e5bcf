package io.b2mash.tms.tendering.tender.dto;

import java.util.UUID;

/** Payload of the offer-accept pre hook. Only a veto has an effect. */
public record OfferDecision(UUID tenderId, UUID offerId, UUID carrierId) {}
