package io.b2mash.tms.tendering.audit;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditEventRecord}.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}. When no actor is
 * given the event is attributed to the system; when no source is given it defaults to
 * {@link AuditSources#INTERNAL}. An actor ID requires an actor type.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("tender.closed")
 *     .entityType("tender")
 *     .entityId(tender.getId())
 *     .details(Map.of("tender_number", tender.getTenderNumber()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(entityType, "entityType must not be null");
    Objects.requireNonNull(entityId, "entityId must not be null");

    if (actorId != null && actorType == null) {
      throw new IllegalStateException("actorType is required when actorId is set");
    }
    String resolvedActorType = actorType != null ? actorType : AuditSources.ACTOR_SYSTEM;
    String resolvedSource = source != null ? source : AuditSources.INTERNAL;

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        actorId,
        resolvedActorType,
        resolvedSource,
        details != null ? details : Map.of());
  }
}
