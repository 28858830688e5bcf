package io.b2mash.tms.tendering.cascade.dto;

import io.b2mash.tms.tendering.tender.TenderMode;
import io.b2mash.tms.tendering.tender.dto.TenderResponse;
import java.util.List;
import java.util.UUID;

/**
 * @param activeTiers tiers currently OPEN, ascending
 */
public record CascadeView(
    UUID rootTenderId,
    UUID orderId,
    TenderMode mode,
    CascadeState state,
    List<Integer> activeTiers,
    List<TenderResponse> tenders) {}
