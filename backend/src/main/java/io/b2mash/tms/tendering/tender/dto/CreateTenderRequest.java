package io.b2mash.tms.tendering.tender.dto;

import io.b2mash.tms.tendering.tender.TenderMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Request to create a single tender.
 *
 * @param brokerId when set, invited carriers must belong to this broker's network at {@code tier};
 *     an absent carrier list then defaults to every carrier of that tier
 * @param carrierIds carriers that receive a PENDING offer; may be null or empty
 * @param openImmediately create the tender OPEN instead of DRAFT
 */
public record CreateTenderRequest(
    @NotNull UUID orderId,
    UUID shipmentId,
    UUID brokerId,
    @NotNull TenderMode mode,
    @Min(0) int tier,
    UUID parentTenderId,
    @NotNull Instant offerDeadline,
    List<UUID> carrierIds,
    boolean openImmediately) {

  public List<UUID> carrierIdsOrEmpty() {
    return carrierIds != null ? carrierIds : List.of();
  }
}
