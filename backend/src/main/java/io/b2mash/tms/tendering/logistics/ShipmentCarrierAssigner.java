package io.b2mash.tms.tendering.logistics;

import java.util.UUID;

/** Assigns the carrier that won a tender to the tendered shipment. */
public interface ShipmentCarrierAssigner {

  /**
   * Called inside the award transaction; throwing rolls the award back.
   *
   * @throws io.b2mash.tms.tendering.exception.ResourceNotFoundException if the shipment is unknown
   */
  void assignCarrier(UUID shipmentId, UUID carrierId);
}
