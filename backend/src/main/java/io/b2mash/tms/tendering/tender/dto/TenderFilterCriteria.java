package io.b2mash.tms.tendering.tender.dto;

import io.b2mash.tms.tendering.tender.TenderMode;
import io.b2mash.tms.tendering.tender.TenderStatus;
import java.util.UUID;

/** Optional filters for tender listing; null fields match everything. */
public record TenderFilterCriteria(
    UUID orderId, TenderStatus status, TenderMode mode, Integer tier) {

  public static TenderFilterCriteria none() {
    return new TenderFilterCriteria(null, null, null, null);
  }
}
