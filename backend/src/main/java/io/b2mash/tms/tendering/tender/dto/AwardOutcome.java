package io.b2mash.tms.tendering.tender.dto;

import java.util.List;
import java.util.UUID;

/** Payload of the tender-award post hook. */
public record AwardOutcome(
    TenderResponse tender, UUID winningOfferId, UUID carrierId, List<UUID> rejectedOfferIds) {}
