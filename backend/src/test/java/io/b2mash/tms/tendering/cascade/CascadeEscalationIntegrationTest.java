package io.b2mash.tms.tendering.cascade;

import static io.b2mash.tms.tendering.testutil.TestTenderFactory.bid;
import static io.b2mash.tms.tendering.testutil.TestTenderFactory.cascade;
import static io.b2mash.tms.tendering.testutil.TestTenderFactory.expireDeadline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.tms.tendering.carrier.InMemoryCarrierRelationSource;
import io.b2mash.tms.tendering.cascade.dto.CascadeResult;
import io.b2mash.tms.tendering.cascade.dto.CascadeState;
import io.b2mash.tms.tendering.cascade.dto.TierRequest;
import io.b2mash.tms.tendering.event.TenderEvent;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.exception.InvalidStateException;
import io.b2mash.tms.tendering.logistics.InMemoryOrderDirectory;
import io.b2mash.tms.tendering.tender.OfferStatus;
import io.b2mash.tms.tendering.tender.TenderAwardService;
import io.b2mash.tms.tendering.tender.TenderDeadlineProcessor;
import io.b2mash.tms.tendering.tender.TenderLifecycleService;
import io.b2mash.tms.tendering.tender.TenderMode;
import io.b2mash.tms.tendering.tender.TenderOfferRepository;
import io.b2mash.tms.tendering.tender.TenderOfferService;
import io.b2mash.tms.tendering.tender.TenderRepository;
import io.b2mash.tms.tendering.tender.TenderStatus;
import io.b2mash.tms.tendering.testutil.TestNetwork;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

/**
 * End-to-end cascade behaviour: a broker with carriers C1 and C2 on tier 0 and C3 on tier 1, tier
 * deadlines at 60 and 120 minutes.
 */
@SpringBootTest
@ActiveProfiles("test")
@RecordApplicationEvents
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class CascadeEscalationIntegrationTest {

  @Autowired private CascadeTenderService cascadeService;
  @Autowired private CascadeEscalationService escalationService;
  @Autowired private CascadeReconciliationProcessor reconciliationProcessor;
  @Autowired private TenderLifecycleService lifecycleService;
  @Autowired private TenderOfferService offerService;
  @Autowired private TenderAwardService awardService;
  @Autowired private TenderDeadlineProcessor deadlineProcessor;
  @Autowired private TenderRepository tenderRepository;
  @Autowired private TenderOfferRepository offerRepository;
  @Autowired private InMemoryCarrierRelationSource relationSource;
  @Autowired private InMemoryOrderDirectory orderDirectory;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private ApplicationEvents events;

  private TestNetwork network;

  private CascadeResult twoTierCascade(TenderMode mode) {
    network = TestNetwork.create(relationSource, orderDirectory, 2, 1);
    return cascadeService.createCascade(
        cascade(
            network, mode, List.of(new TierRequest(0, null, 60), new TierRequest(1, null, 120))));
  }

  private UUID tier(CascadeResult result, int index) {
    return result.createdTenders().get(index).id();
  }

  private TenderStatus statusOf(UUID tenderId) {
    return tenderRepository.findById(tenderId).orElseThrow().getStatus();
  }

  private long openedEvents(UUID tenderId) {
    return events.stream(TenderEvent.class)
        .filter(e -> e.tenderId().equals(tenderId) && e.type() == TenderEventType.TENDER_OPENED)
        .count();
  }

  @Test
  void sequentialCascade_startsWithTierZeroOpen() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);

    assertThat(statusOf(tier(result, 0))).isEqualTo(TenderStatus.OPEN);
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.DRAFT);
    var view = cascadeService.getCascade(result.rootTenderId());
    assertThat(view.state()).isEqualTo(CascadeState.TIER_ACTIVE);
    assertThat(view.activeTiers()).containsExactly(0);
  }

  @Test
  void closingTierWithoutBids_opensNextTier() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);

    lifecycleService.close(tier(result, 0));

    assertThat(statusOf(tier(result, 0))).isEqualTo(TenderStatus.CLOSED);
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.OPEN);
    assertThat(openedEvents(tier(result, 1))).isEqualTo(1);
    assertThat(cascadeService.getCascade(result.rootTenderId()).activeTiers()).containsExactly(1);
  }

  @Test
  void deadlineSweep_closesExpiredTierAndEscalates() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    expireDeadline(jdbcTemplate, tier(result, 0));

    deadlineProcessor.closeExpiredTenders();

    assertThat(statusOf(tier(result, 0))).isEqualTo(TenderStatus.CLOSED);
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.OPEN);
  }

  @Test
  void awardOnTierZero_resolvesCascadeWithoutEscalating() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    var winner = offerService.submitOffer(tier(result, 0), network.carrier(0, 0), bid("1200.00"));
    var rival = offerService.submitOffer(tier(result, 0), network.carrier(0, 1), bid("1250.00"));

    lifecycleService.close(tier(result, 0));
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.DRAFT);
    assertThat(cascadeService.getCascade(result.rootTenderId()).state())
        .isEqualTo(CascadeState.TIER_ACTIVE);

    awardService.award(tier(result, 0), winner.id());

    assertThat(statusOf(tier(result, 0))).isEqualTo(TenderStatus.AWARDED);
    assertThat(offerRepository.findById(rival.id()).orElseThrow().getStatus())
        .isEqualTo(OfferStatus.REJECTED);
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.DRAFT);
    assertThat(openedEvents(tier(result, 1))).isZero();
    assertThat(cascadeService.getCascade(result.rootTenderId()).state())
        .isEqualTo(CascadeState.RESOLVED);
  }

  @Test
  void parallelCascade_tiersCloseIndependently() {
    var result = twoTierCascade(TenderMode.PARALLEL);
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.OPEN);

    lifecycleService.close(tier(result, 0));

    assertThat(statusOf(tier(result, 0))).isEqualTo(TenderStatus.CLOSED);
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.OPEN);
    assertThat(cascadeService.getCascade(result.rootTenderId()).activeTiers()).containsExactly(1);
  }

  @Test
  void closingTwice_failsWithoutEscalatingAgain() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    lifecycleService.close(tier(result, 0));

    assertThatThrownBy(() -> lifecycleService.close(tier(result, 0)))
        .isInstanceOf(InvalidStateException.class);
    assertThat(openedEvents(tier(result, 1))).isEqualTo(1);
  }

  @Test
  void escalateFrom_repeatedCall_opensNothingMore() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    lifecycleService.close(tier(result, 0));

    assertThat(escalationService.escalateFrom(tier(result, 0))).isEmpty();
    assertThat(openedEvents(tier(result, 1))).isEqualTo(1);
  }

  @Test
  void cancelledTier_doesNotEscalate() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);

    lifecycleService.cancel(tier(result, 0), "Order withdrawn");

    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.DRAFT);
    assertThat(escalationService.escalateFrom(tier(result, 0))).isEmpty();
    assertThat(cascadeService.getCascade(result.rootTenderId()).state())
        .isEqualTo(CascadeState.EXHAUSTED);
  }

  @Test
  void rejectingLastBidOfClosedTier_opensNextTier() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    var offer = offerService.submitOffer(tier(result, 0), network.carrier(0, 0), bid("900.00"));
    lifecycleService.close(tier(result, 0));
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.DRAFT);

    offerService.rejectOffer(offer.id());

    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.OPEN);
  }

  @Test
  void withdrawingLastBidOfClosedTier_opensNextTier() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    offerService.submitOffer(tier(result, 0), network.carrier(0, 1), bid("900.00"));
    lifecycleService.close(tier(result, 0));

    offerService.withdrawOffer(tier(result, 0), network.carrier(0, 1));

    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.OPEN);
  }

  @Test
  void rejectingOneOfTwoBids_keepsTierPending() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    var first = offerService.submitOffer(tier(result, 0), network.carrier(0, 0), bid("900.00"));
    offerService.submitOffer(tier(result, 0), network.carrier(0, 1), bid("950.00"));
    lifecycleService.close(tier(result, 0));

    offerService.rejectOffer(first.id());

    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.DRAFT);
  }

  @Test
  void exhaustedAfterLastTierCloses() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    lifecycleService.close(tier(result, 0));

    lifecycleService.close(tier(result, 1));

    var view = cascadeService.getCascade(result.rootTenderId());
    assertThat(view.state()).isEqualTo(CascadeState.EXHAUSTED);
    assertThat(view.activeTiers()).isEmpty();
  }

  @Test
  void waitingTierPastItsDeadline_extendedThenEscalated_acceptsOffers() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    expireDeadline(jdbcTemplate, tier(result, 1));
    lifecycleService.extendDeadline(tier(result, 1), Instant.now().plus(2, ChronoUnit.HOURS));

    lifecycleService.close(tier(result, 0));
    var offer = offerService.submitOffer(tier(result, 1), network.carrier(1, 0), bid("1400.00"));

    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.OPEN);
    assertThat(offer.status()).isEqualTo(OfferStatus.SUBMITTED);
  }

  @Test
  void reconcile_closedTierWithDraftChild_opensIt() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    // Simulates a close whose escalation never ran
    jdbcTemplate.update(
        "UPDATE tenders SET status = 'CLOSED', closed_at = CURRENT_TIMESTAMP WHERE id = ?",
        tier(result, 0));

    int opened = reconciliationProcessor.reconcile();

    assertThat(opened).isGreaterThanOrEqualTo(1);
    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.OPEN);
  }

  @Test
  void reconcile_closedTierWithPendingBid_leavesChildDraft() {
    var result = twoTierCascade(TenderMode.SEQUENTIAL);
    offerService.submitOffer(tier(result, 0), network.carrier(0, 0), bid("900.00"));
    lifecycleService.close(tier(result, 0));

    reconciliationProcessor.reconcile();

    assertThat(statusOf(tier(result, 1))).isEqualTo(TenderStatus.DRAFT);
  }
}
