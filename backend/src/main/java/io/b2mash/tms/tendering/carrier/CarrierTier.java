package io.b2mash.tms.tendering.carrier;

import java.util.List;
import java.util.UUID;

/** Carriers of one tier, de-duplicated, in the order the relations were first seen. */
public record CarrierTier(int tier, List<UUID> carrierIds) {

  public CarrierTier {
    carrierIds = List.copyOf(carrierIds);
  }
}
