package io.b2mash.tms.tendering.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the append-only audit trail of tender and offer transitions. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /**
   * Returns the audit trail of one entity, oldest first.
   *
   * @param entityType "tender" or "offer"
   * @param entityId the entity's ID
   */
  List<AuditEvent> findTrail(String entityType, UUID entityId);
}
