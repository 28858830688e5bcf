package io.b2mash.tms.tendering.cascade;

import io.b2mash.tms.tendering.carrier.CarrierTier;
import io.b2mash.tms.tendering.carrier.TierResolver;
import io.b2mash.tms.tendering.cascade.dto.CascadeResult;
import io.b2mash.tms.tendering.cascade.dto.CascadeState;
import io.b2mash.tms.tendering.cascade.dto.CascadeTenderRequest;
import io.b2mash.tms.tendering.cascade.dto.CascadeView;
import io.b2mash.tms.tendering.cascade.dto.TierRequest;
import io.b2mash.tms.tendering.config.TenderingProperties;
import io.b2mash.tms.tendering.event.TenderEventPublisher;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.exception.InvalidStateException;
import io.b2mash.tms.tendering.exception.ResourceNotFoundException;
import io.b2mash.tms.tendering.hook.HookRegistry;
import io.b2mash.tms.tendering.hook.TenderHooks;
import io.b2mash.tms.tendering.logistics.OrderDirectory;
import io.b2mash.tms.tendering.tender.OfferStatus;
import io.b2mash.tms.tendering.tender.Tender;
import io.b2mash.tms.tendering.tender.TenderMode;
import io.b2mash.tms.tendering.tender.TenderNumberGenerator;
import io.b2mash.tms.tendering.tender.TenderOfferRepository;
import io.b2mash.tms.tendering.tender.TenderRepository;
import io.b2mash.tms.tendering.tender.TenderService;
import io.b2mash.tms.tendering.tender.TenderStatus;
import io.b2mash.tms.tendering.tender.dto.CreateTenderRequest;
import io.b2mash.tms.tendering.tender.dto.TenderResponse;
import jakarta.validation.Valid;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Builds multi-tier cascades over a broker's carrier network and reports their progress.
 *
 * <p>A cascade is created in one transaction: one tender per requested tier that still has
 * eligible carriers, all sharing one tender number suffixed {@code -T<tier>}. In PARALLEL mode
 * every tier opens at once; in SEQUENTIAL mode only the lowest tier opens and each later tier waits
 * in DRAFT, chained to the previous one, until {@link CascadeEscalationService} opens it.
 */
@Service
@Validated
public class CascadeTenderService {

  private static final Logger log = LoggerFactory.getLogger(CascadeTenderService.class);

  private final TierResolver tierResolver;
  private final OrderDirectory orderDirectory;
  private final TenderService tenderService;
  private final TenderNumberGenerator numberGenerator;
  private final TenderRepository tenderRepository;
  private final TenderOfferRepository offerRepository;
  private final HookRegistry hookRegistry;
  private final TenderEventPublisher eventPublisher;
  private final TenderingProperties properties;

  public CascadeTenderService(
      TierResolver tierResolver,
      OrderDirectory orderDirectory,
      TenderService tenderService,
      TenderNumberGenerator numberGenerator,
      TenderRepository tenderRepository,
      TenderOfferRepository offerRepository,
      HookRegistry hookRegistry,
      TenderEventPublisher eventPublisher,
      TenderingProperties properties) {
    this.tierResolver = tierResolver;
    this.orderDirectory = orderDirectory;
    this.tenderService = tenderService;
    this.numberGenerator = numberGenerator;
    this.tenderRepository = tenderRepository;
    this.offerRepository = offerRepository;
    this.hookRegistry = hookRegistry;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
  }

  @Transactional
  public CascadeResult createCascade(@Valid CascadeTenderRequest request) {
    var effective = hookRegistry.runPre(TenderHooks.BEFORE_CASCADE_CREATE, request);
    validateTierRequests(effective.tiers());

    if (!orderDirectory.exists(effective.orderId())) {
      throw new ResourceNotFoundException("Order", effective.orderId());
    }

    var plan = planTiers(effective);
    if (plan.isEmpty()) {
      throw new InvalidStateException(
          "No eligible tiers",
          "None of the requested tiers has an active carrier of broker " + effective.brokerId());
    }

    var baseNumber = numberGenerator.nextNumber();
    var now = Instant.now();
    var created = new ArrayList<Tender>(plan.size());
    Tender root = null;
    Tender previous = null;

    for (var tier : plan) {
      UUID parentId = null;
      if (previous != null) {
        parentId = effective.mode() == TenderMode.SEQUENTIAL ? previous.getId() : root.getId();
      }
      boolean openNow = effective.mode() == TenderMode.PARALLEL || root == null;
      var tierRequest =
          new CreateTenderRequest(
              effective.orderId(),
              null,
              effective.brokerId(),
              effective.mode(),
              tier.request().tier(),
              parentId,
              now.plus(Duration.ofMinutes(tier.request().offerDeadlineMinutes())),
              tier.carrierIds(),
              openNow);
      var tender =
          tenderService.createCascadeTier(
              tierRequest,
              baseNumber + "-T" + tier.request().tier(),
              root != null ? root.getId() : null);
      if (root == null) {
        root = tender;
      }
      previous = tender;
      created.add(tender);
    }

    eventPublisher.tender(TenderEventType.TENDER_CASCADED, root);
    log.info(
        "Created {} cascade {} for order {} with {} tier(s)",
        effective.mode(),
        baseNumber,
        effective.orderId(),
        created.size());

    var result =
        new CascadeResult(
            root.getId(),
            created.stream()
                .map(
                    t ->
                        TenderResponse.from(
                            t, offerRepository.findByTenderIdOrderByCreatedAtAsc(t.getId())))
                .toList(),
            created.size());
    hookRegistry.publishPost(TenderHooks.AFTER_CASCADE_CREATE, result);
    return result;
  }

  /** Current state of the cascade rooted at {@code rootTenderId}, derived from its tenders. */
  @Transactional(readOnly = true)
  public CascadeView getCascade(UUID rootTenderId) {
    var root =
        tenderRepository
            .findById(rootTenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", rootTenderId));
    if (!root.isCascadeRoot()) {
      throw ResourceNotFoundException.notCascadeRoot(rootTenderId, root.getTenderNumber());
    }

    var tenders =
        tenderRepository.findByCascadeRootIdOrderByTierAsc(rootTenderId).stream()
            .map(
                t ->
                    TenderResponse.from(
                        t, offerRepository.findByTenderIdOrderByCreatedAtAsc(t.getId())))
            .toList();
    var activeTiers =
        tenders.stream()
            .filter(t -> t.status() == TenderStatus.OPEN)
            .map(TenderResponse::tier)
            .toList();
    return new CascadeView(
        rootTenderId, root.getOrderId(), root.getMode(), deriveState(tenders), activeTiers, tenders);
  }

  static CascadeState deriveState(List<TenderResponse> tenders) {
    boolean resolved =
        tenders.stream()
            .anyMatch(
                t ->
                    t.status() == TenderStatus.AWARDED
                        || t.offers().stream().anyMatch(o -> o.status() == OfferStatus.ACCEPTED));
    if (resolved) {
      return CascadeState.RESOLVED;
    }
    if (tenders.stream().allMatch(t -> t.status() == TenderStatus.DRAFT)) {
      return CascadeState.AWAITING_TIER_RESOLUTION;
    }
    boolean biddingOrAwaitingAward =
        tenders.stream()
            .anyMatch(
                t ->
                    t.status() == TenderStatus.OPEN
                        || (t.status() == TenderStatus.CLOSED
                            && t.offers().stream()
                                .anyMatch(o -> o.status() == OfferStatus.SUBMITTED)));
    if (biddingOrAwaitingAward) {
      return CascadeState.TIER_ACTIVE;
    }
    // A DRAFT tier can still open unless a cancellation cut the chain
    boolean cancelled = tenders.stream().anyMatch(t -> t.status() == TenderStatus.CANCELLED);
    boolean draftRemaining = tenders.stream().anyMatch(t -> t.status() == TenderStatus.DRAFT);
    return draftRemaining && !cancelled ? CascadeState.TIER_ACTIVE : CascadeState.EXHAUSTED;
  }

  private void validateTierRequests(List<TierRequest> tiers) {
    if (tiers.size() > properties.maxCascadeTiers()) {
      throw new InvalidStateException(
          "Too many tiers",
          "A cascade accepts at most "
              + properties.maxCascadeTiers()
              + " tiers, got "
              + tiers.size());
    }
    var seen = new HashSet<Integer>();
    for (var tier : tiers) {
      if (!seen.add(tier.tier())) {
        throw new InvalidStateException(
            "Duplicate tier", "Tier " + tier.tier() + " is requested more than once");
      }
    }
  }

  /** Requested tiers in ascending order, intersected with the broker's network; empty ones skipped. */
  private List<PlannedTier> planTiers(CascadeTenderRequest request) {
    Map<Integer, List<UUID>> network =
        tierResolver.resolve(request.brokerId()).stream()
            .collect(Collectors.toMap(CarrierTier::tier, CarrierTier::carrierIds));

    var plan = new ArrayList<PlannedTier>();
    var ordered =
        request.tiers().stream().sorted(Comparator.comparingInt(TierRequest::tier)).toList();
    for (var tierRequest : ordered) {
      var carriers = network.getOrDefault(tierRequest.tier(), List.of());
      if (tierRequest.hasCarrierFilter()) {
        var filter = new HashSet<>(tierRequest.carrierIds());
        carriers = carriers.stream().filter(filter::contains).toList();
      }
      if (carriers.isEmpty()) {
        log.info(
            "Skipping tier {} of broker {}: no eligible carriers",
            tierRequest.tier(),
            request.brokerId());
        continue;
      }
      plan.add(new PlannedTier(tierRequest, carriers));
    }
    return plan;
  }

  private record PlannedTier(TierRequest request, List<UUID> carrierIds) {}
}
