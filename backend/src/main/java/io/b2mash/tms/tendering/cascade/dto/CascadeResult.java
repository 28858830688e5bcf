package io.b2mash.tms.tendering.cascade.dto;

import io.b2mash.tms.tendering.tender.dto.TenderResponse;
import java.util.List;
import java.util.UUID;

/**
 * @param createdTenders one tender per surviving tier, ascending by tier
 * @param totalTiers number of tenders created
 */
public record CascadeResult(UUID rootTenderId, List<TenderResponse> createdTenders, int totalTiers) {}
