package io.b2mash.tms.tendering.event;

import io.b2mash.tms.tendering.tender.Tender;
import io.b2mash.tms.tendering.tender.TenderMode;
import io.b2mash.tms.tendering.tender.TenderStatus;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record TenderEvent(
    TenderEventType type,
    UUID tenderId,
    String tenderNumber,
    UUID orderId,
    UUID cascadeRootId,
    UUID parentTenderId,
    TenderMode mode,
    int tier,
    TenderStatus status,
    Instant occurredAt)
    implements TenderDomainEvent {

  public static TenderEvent of(TenderEventType type, Tender tender) {
    if (!"tender".equals(type.entityType())) {
      throw new IllegalArgumentException(type + " is not a tender event");
    }
    return new TenderEvent(
        type,
        tender.getId(),
        tender.getTenderNumber(),
        tender.getOrderId(),
        tender.getCascadeRootId(),
        tender.getParentTenderId(),
        tender.getMode(),
        tender.getTier(),
        tender.getStatus(),
        Instant.now());
  }

  @Override
  public UUID entityId() {
    return tenderId;
  }

  @Override
  public Map<String, Object> details() {
    var details = new LinkedHashMap<String, Object>();
    details.put("tender_number", tenderNumber);
    details.put("order_id", orderId.toString());
    details.put("status", status.name());
    details.put("mode", mode.name());
    details.put("tier", tier);
    if (cascadeRootId != null) {
      details.put("cascade_root_id", cascadeRootId.toString());
    }
    if (parentTenderId != null) {
      details.put("parent_tender_id", parentTenderId.toString());
    }
    return details;
  }
}
