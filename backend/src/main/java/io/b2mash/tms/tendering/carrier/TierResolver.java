package io.b2mash.tms.tendering.carrier;

import io.b2mash.tms.tendering.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Groups a broker's active carriers by tier, lowest (preferred) tier first. */
@Service
public class TierResolver {

  private static final Logger log = LoggerFactory.getLogger(TierResolver.class);

  private final CarrierRelationSource relationSource;

  public TierResolver(CarrierRelationSource relationSource) {
    this.relationSource = relationSource;
  }

  /**
   * Resolves the broker's ACTIVE relations into tiers, ascending. Carriers are de-duplicated within
   * a tier keeping first-seen order. A known broker without active relations yields an empty list.
   *
   * @throws ResourceNotFoundException if the broker is unknown
   */
  public List<CarrierTier> resolve(UUID brokerId) {
    var relations =
        relationSource
            .findRelations(brokerId)
            .orElseThrow(() -> new ResourceNotFoundException("Broker", brokerId));

    Map<Integer, Set<UUID>> byTier = new TreeMap<>();
    for (var relation : relations) {
      if (!relation.isActive()) {
        continue;
      }
      byTier.computeIfAbsent(relation.tier(), k -> new LinkedHashSet<>()).add(relation.carrierId());
    }

    var tiers = new ArrayList<CarrierTier>(byTier.size());
    byTier.forEach((tier, carriers) -> tiers.add(new CarrierTier(tier, new ArrayList<>(carriers))));
    log.debug("Resolved {} tier(s) for broker {}", tiers.size(), brokerId);
    return tiers;
  }

  /** Carriers of one tier; empty when the broker has no active carrier at that tier. */
  public List<UUID> resolveTier(UUID brokerId, int tier) {
    return resolve(brokerId).stream()
        .filter(t -> t.tier() == tier)
        .findFirst()
        .map(CarrierTier::carrierIds)
        .orElse(List.of());
  }
}
