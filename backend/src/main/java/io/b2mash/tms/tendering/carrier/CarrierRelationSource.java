package io.b2mash.tms.tendering.carrier;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Read access to a broker's carrier network. */
public interface CarrierRelationSource {

  /**
   * Returns every relation of the broker, whatever its status.
   *
   * @return empty if the broker is unknown
   */
  Optional<List<CarrierRelation>> findRelations(UUID brokerId);
}
