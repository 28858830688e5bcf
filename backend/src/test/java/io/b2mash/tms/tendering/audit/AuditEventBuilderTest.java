package io.b2mash.tms.tendering.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class AuditEventBuilderTest {

  private static final UUID TENDER_ID = UUID.randomUUID();

  @Test
  void build_withoutActorOrSource_defaultsToSystemInternal() {
    var record =
        AuditEventBuilder.builder()
            .eventType("tender.closed")
            .entityType("tender")
            .entityId(TENDER_ID)
            .build();

    assertThat(record.actorId()).isNull();
    assertThat(record.actorType()).isEqualTo(AuditSources.ACTOR_SYSTEM);
    assertThat(record.source()).isEqualTo(AuditSources.INTERNAL);
    assertThat(record.details()).isEmpty();
  }

  @Test
  void build_keepsExplicitActorAndSource() {
    var carrierId = UUID.randomUUID();

    var record =
        AuditEventBuilder.builder()
            .eventType("offer.submitted")
            .entityType("offer")
            .entityId(UUID.randomUUID())
            .actorId(carrierId)
            .actorType(AuditSources.ACTOR_CARRIER)
            .source(AuditSources.SWEEP)
            .build();

    assertThat(record.actorId()).isEqualTo(carrierId);
    assertThat(record.actorType()).isEqualTo(AuditSources.ACTOR_CARRIER);
    assertThat(record.source()).isEqualTo(AuditSources.SWEEP);
  }

  @Test
  void build_actorIdWithoutType_throws() {
    var builder =
        AuditEventBuilder.builder()
            .eventType("offer.submitted")
            .entityType("offer")
            .entityId(UUID.randomUUID())
            .actorId(UUID.randomUUID());

    assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void build_missingEventType_throws() {
    var builder = AuditEventBuilder.builder().entityType("tender").entityId(TENDER_ID);

    assertThatThrownBy(builder::build).isInstanceOf(NullPointerException.class);
  }
}
