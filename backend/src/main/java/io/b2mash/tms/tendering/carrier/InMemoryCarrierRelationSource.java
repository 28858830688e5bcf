package io.b2mash.tms.tendering.carrier;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Component;

/**
 * Default {@link CarrierRelationSource} holding the network in memory. Hosts that own the
 * relationship graph replace this bean.
 */
@Component
public class InMemoryCarrierRelationSource implements CarrierRelationSource {

  private final Map<UUID, List<CarrierRelation>> relationsByBroker = new ConcurrentHashMap<>();

  @Override
  public Optional<List<CarrierRelation>> findRelations(UUID brokerId) {
    return Optional.ofNullable(relationsByBroker.get(brokerId)).map(List::copyOf);
  }

  /** Makes the broker known, with no relations yet. */
  public void registerBroker(UUID brokerId) {
    relationsByBroker.computeIfAbsent(brokerId, k -> new CopyOnWriteArrayList<>());
  }

  public void addRelation(CarrierRelation relation) {
    relationsByBroker
        .computeIfAbsent(relation.brokerId(), k -> new CopyOnWriteArrayList<>())
        .add(relation);
  }

  public void addRelation(UUID brokerId, UUID carrierId, int tier) {
    addRelation(new CarrierRelation(brokerId, carrierId, tier, RelationStatus.ACTIVE));
  }

  public void clear() {
    relationsByBroker.clear();
  }
}
