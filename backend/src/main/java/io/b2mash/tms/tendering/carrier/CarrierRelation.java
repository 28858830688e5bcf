package io.b2mash.tms.tendering.carrier;

import java.util.Objects;
import java.util.UUID;

/** A broker→carrier edge of the pre-qualified carrier network. Lower tiers are preferred. */
public record CarrierRelation(UUID brokerId, UUID carrierId, int tier, RelationStatus status) {

  public CarrierRelation {
    Objects.requireNonNull(brokerId, "brokerId must not be null");
    Objects.requireNonNull(carrierId, "carrierId must not be null");
    Objects.requireNonNull(status, "status must not be null");
    if (tier < 0) {
      throw new IllegalArgumentException("tier must not be negative: " + tier);
    }
  }

  public boolean isActive() {
    return status == RelationStatus.ACTIVE;
  }
}
