package io.b2mash.tms.tendering.tender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.tms.tendering.exception.InvalidStateException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TenderTest {

  private static final UUID ORDER_ID = UUID.randomUUID();
  private static final UUID BROKER_ID = UUID.randomUUID();
  private static final Instant DEADLINE = Instant.now().plus(1, ChronoUnit.HOURS);

  private Tender buildTender() {
    return new Tender(
        "TND-000001", ORDER_ID, null, BROKER_ID, TenderMode.SEQUENTIAL, 0, null, DEADLINE);
  }

  @Test
  void constructor_setsDraftStatus() {
    var tender = buildTender();

    assertThat(tender.getStatus()).isEqualTo(TenderStatus.DRAFT);
    assertThat(tender.getTenderNumber()).isEqualTo("TND-000001");
    assertThat(tender.getOrderId()).isEqualTo(ORDER_ID);
    assertThat(tender.getBrokerId()).isEqualTo(BROKER_ID);
    assertThat(tender.getTier()).isZero();
    assertThat(tender.getOfferDeadline()).isEqualTo(DEADLINE);
    assertThat(tender.getParentTenderId()).isNull();
    assertThat(tender.getCascadeRootId()).isNull();
    assertThat(tender.getOpenedAt()).isNull();
  }

  @Test
  void constructor_negativeTier_throws() {
    assertThatThrownBy(
            () ->
                new Tender(
                    "TND-000002", ORDER_ID, null, null, TenderMode.PARALLEL, -1, null, DEADLINE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_requiresDeadline() {
    assertThatThrownBy(
            () -> new Tender("TND-000003", ORDER_ID, null, null, TenderMode.PARALLEL, 0, null, null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void extendDeadline_laterDeadline_updates() {
    var tender = buildTender();
    var later = DEADLINE.plus(1, ChronoUnit.HOURS);

    tender.extendDeadline(later, Instant.now());

    assertThat(tender.getOfferDeadline()).isEqualTo(later);
    assertThat(tender.isDeadlinePassed(DEADLINE.plus(30, ChronoUnit.MINUTES))).isFalse();
  }

  @Test
  void extendDeadline_notLaterThanCurrent_throws() {
    var tender = buildTender();

    assertThatThrownBy(() -> tender.extendDeadline(DEADLINE, Instant.now()))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void extendDeadline_inThePast_throws() {
    var tender = buildTender();
    var now = DEADLINE.plus(2, ChronoUnit.HOURS);

    assertThatThrownBy(() -> tender.extendDeadline(DEADLINE.plus(1, ChronoUnit.HOURS), now))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void extendDeadline_afterClose_throws() {
    var tender = buildTender();
    tender.open();
    tender.close();

    assertThatThrownBy(
            () -> tender.extendDeadline(DEADLINE.plus(1, ChronoUnit.HOURS), Instant.now()))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void open_fromDraft_succeeds() {
    var tender = buildTender();

    tender.open();

    assertThat(tender.getStatus()).isEqualTo(TenderStatus.OPEN);
    assertThat(tender.getOpenedAt()).isNotNull();
  }

  @Test
  void open_fromOpen_throws() {
    var tender = buildTender();
    tender.open();

    assertThatThrownBy(tender::open)
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Invalid tender state");
  }

  @Test
  void close_fromOpen_succeeds() {
    var tender = buildTender();
    tender.open();

    tender.close();

    assertThat(tender.getStatus()).isEqualTo(TenderStatus.CLOSED);
    assertThat(tender.getClosedAt()).isNotNull();
  }

  @Test
  void close_fromDraft_throws() {
    var tender = buildTender();

    assertThatThrownBy(tender::close).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void close_twice_throws() {
    var tender = buildTender();
    tender.open();
    tender.close();

    assertThatThrownBy(tender::close).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void markAwarded_fromClosed_recordsWinner() {
    var tender = buildTender();
    tender.open();
    tender.close();
    var offerId = UUID.randomUUID();
    var carrierId = UUID.randomUUID();

    tender.markAwarded(offerId, carrierId);

    assertThat(tender.getStatus()).isEqualTo(TenderStatus.AWARDED);
    assertThat(tender.getAwardedOfferId()).isEqualTo(offerId);
    assertThat(tender.getAwardedCarrierId()).isEqualTo(carrierId);
    assertThat(tender.getAwardedAt()).isNotNull();
    assertThat(tender.isTerminal()).isTrue();
  }

  @Test
  void markAwarded_fromOpen_throws() {
    var tender = buildTender();
    tender.open();

    assertThatThrownBy(() -> tender.markAwarded(UUID.randomUUID(), UUID.randomUUID()))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void cancel_fromDraftOpenOrClosed_succeeds() {
    var draft = buildTender();
    draft.cancel("order withdrawn");
    assertThat(draft.getStatus()).isEqualTo(TenderStatus.CANCELLED);
    assertThat(draft.getCancelReason()).isEqualTo("order withdrawn");
    assertThat(draft.getCancelledAt()).isNotNull();

    var open = buildTender();
    open.open();
    open.cancel(null);
    assertThat(open.getStatus()).isEqualTo(TenderStatus.CANCELLED);

    var closed = buildTender();
    closed.open();
    closed.close();
    closed.cancel("no longer needed");
    assertThat(closed.getStatus()).isEqualTo(TenderStatus.CANCELLED);
  }

  @Test
  void cancel_fromCancelled_throws() {
    var tender = buildTender();
    tender.cancel("first");

    assertThatThrownBy(() -> tender.cancel("second")).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void cancel_fromAwarded_throws() {
    var tender = buildTender();
    tender.open();
    tender.close();
    tender.markAwarded(UUID.randomUUID(), UUID.randomUUID());

    assertThatThrownBy(() -> tender.cancel("too late")).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void isDeadlinePassed_comparesAgainstDeadline() {
    var tender = buildTender();

    assertThat(tender.isDeadlinePassed(DEADLINE.minusSeconds(1))).isFalse();
    assertThat(tender.isDeadlinePassed(DEADLINE)).isFalse();
    assertThat(tender.isDeadlinePassed(DEADLINE.plusSeconds(1))).isTrue();
  }
}
