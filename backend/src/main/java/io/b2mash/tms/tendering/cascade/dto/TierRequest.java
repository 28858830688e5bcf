package io.b2mash.tms.tendering.cascade.dto;

import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.UUID;

/**
 * One tier of a cascade request.
 *
 * @param carrierIds optional filter intersected with the tier's carriers; null or empty keeps all
 * @param offerDeadlineMinutes minutes from creation until the tier's offer deadline
 */
public record TierRequest(
    @Min(0) int tier, List<UUID> carrierIds, @Min(1) int offerDeadlineMinutes) {

  public boolean hasCarrierFilter() {
    return carrierIds != null && !carrierIds.isEmpty();
  }
}
