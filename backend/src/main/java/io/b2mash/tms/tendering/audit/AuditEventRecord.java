package io.b2mash.tms.tendering.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)} for recording audit events.
 * Constructed by {@link AuditEventBuilder}.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited ("tender", "offer")
 * @param entityId the audited entity's ID
 * @param actorId the acting party, null for system transitions
 * @param actorType "CARRIER" or "SYSTEM"
 * @param source where the transition originated ("INTERNAL" or "SWEEP")
 * @param details free-form key/value payload, serialized to JSON
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    String source,
    Map<String, Object> details) {}
