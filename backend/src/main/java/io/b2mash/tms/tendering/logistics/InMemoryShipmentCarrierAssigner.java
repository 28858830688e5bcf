package io.b2mash.tms.tendering.logistics;

import io.b2mash.tms.tendering.exception.ResourceNotFoundException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class InMemoryShipmentCarrierAssigner implements ShipmentCarrierAssigner {

  private static final Logger log = LoggerFactory.getLogger(InMemoryShipmentCarrierAssigner.class);

  private final Set<UUID> shipments = ConcurrentHashMap.newKeySet();
  private final Map<UUID, UUID> assignedCarriers = new ConcurrentHashMap<>();

  public void registerShipment(UUID shipmentId) {
    shipments.add(shipmentId);
  }

  @Override
  public void assignCarrier(UUID shipmentId, UUID carrierId) {
    if (!shipments.contains(shipmentId)) {
      throw new ResourceNotFoundException("Shipment", shipmentId);
    }
    assignedCarriers.put(shipmentId, carrierId);
    log.info("Assigned carrier {} to shipment {}", carrierId, shipmentId);
  }

  public Optional<UUID> getAssignedCarrier(UUID shipmentId) {
    return Optional.ofNullable(assignedCarriers.get(shipmentId));
  }
}
