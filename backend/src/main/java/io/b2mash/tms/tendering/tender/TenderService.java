package io.b2mash.tms.tendering.tender;

import io.b2mash.tms.tendering.carrier.TierResolver;
import io.b2mash.tms.tendering.config.TenderingProperties;
import io.b2mash.tms.tendering.event.TenderEventPublisher;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.exception.InvalidStateException;
import io.b2mash.tms.tendering.exception.ResourceNotFoundException;
import io.b2mash.tms.tendering.hook.HookRegistry;
import io.b2mash.tms.tendering.hook.TenderHooks;
import io.b2mash.tms.tendering.logistics.OrderDirectory;
import io.b2mash.tms.tendering.tender.dto.CreateTenderRequest;
import io.b2mash.tms.tendering.tender.dto.OfferResponse;
import io.b2mash.tms.tendering.tender.dto.TenderFilterCriteria;
import io.b2mash.tms.tendering.tender.dto.TenderResponse;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/** Creates tenders with their PENDING offer placeholders and answers tender/offer queries. */
@Service
@Validated
public class TenderService {

  private static final Logger log = LoggerFactory.getLogger(TenderService.class);

  private final TenderRepository tenderRepository;
  private final TenderOfferRepository offerRepository;
  private final TenderNumberGenerator numberGenerator;
  private final OrderDirectory orderDirectory;
  private final TierResolver tierResolver;
  private final HookRegistry hookRegistry;
  private final TenderEventPublisher eventPublisher;
  private final TenderingProperties properties;

  public TenderService(
      TenderRepository tenderRepository,
      TenderOfferRepository offerRepository,
      TenderNumberGenerator numberGenerator,
      OrderDirectory orderDirectory,
      TierResolver tierResolver,
      HookRegistry hookRegistry,
      TenderEventPublisher eventPublisher,
      TenderingProperties properties) {
    this.tenderRepository = tenderRepository;
    this.offerRepository = offerRepository;
    this.numberGenerator = numberGenerator;
    this.orderDirectory = orderDirectory;
    this.tierResolver = tierResolver;
    this.hookRegistry = hookRegistry;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
  }

  /**
   * Creates a standalone tender, or one linked under an existing parent. A tender with a parent
   * joins the parent's cascade.
   */
  @Transactional
  public TenderResponse createTender(@Valid CreateTenderRequest request) {
    if (!orderDirectory.exists(request.orderId())) {
      throw new ResourceNotFoundException("Order", request.orderId());
    }
    var effective = hookRegistry.runPre(TenderHooks.BEFORE_TENDER_CREATE, request);

    UUID cascadeRootId = null;
    if (effective.parentTenderId() != null) {
      var parent =
          tenderRepository
              .findById(effective.parentTenderId())
              .orElseThrow(
                  () -> new ResourceNotFoundException("Tender", effective.parentTenderId()));
      if (effective.tier() <= parent.getTier()) {
        throw new InvalidStateException(
            "Invalid tender tier",
            "Tier "
                + effective.tier()
                + " must be greater than parent tier "
                + parent.getTier());
      }
      cascadeRootId = parent.getCascadeRootId();
    }

    var carrierIds = resolveInvitedCarriers(effective);
    var tender = persist(effective, numberGenerator.nextNumber(), cascadeRootId, false, carrierIds);
    return TenderResponse.from(
        tender, offerRepository.findByTenderIdOrderByCreatedAtAsc(tender.getId()));
  }

  /**
   * Creates one tier of a cascade inside the caller's transaction. Runs the tender-create hooks,
   * so a veto aborts the whole cascade.
   *
   * @param cascadeRootId root of the cascade, or null when this tender is the root
   */
  @Transactional
  public Tender createCascadeTier(
      CreateTenderRequest request, String tenderNumber, UUID cascadeRootId) {
    var effective = hookRegistry.runPre(TenderHooks.BEFORE_TENDER_CREATE, request);
    return persist(
        effective, tenderNumber, cascadeRootId, cascadeRootId == null, effective.carrierIdsOrEmpty());
  }

  @Transactional(readOnly = true)
  public TenderResponse getTender(UUID tenderId) {
    var tender =
        tenderRepository
            .findById(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
    return TenderResponse.from(tender, offerRepository.findByTenderIdOrderByCreatedAtAsc(tenderId));
  }

  @Transactional(readOnly = true)
  public List<TenderResponse> findTenders(TenderFilterCriteria criteria) {
    var filter = criteria != null ? criteria : TenderFilterCriteria.none();
    return tenderRepository
        .findFiltered(filter.orderId(), filter.status(), filter.mode(), filter.tier())
        .stream()
        .map(
            t -> TenderResponse.from(t, offerRepository.findByTenderIdOrderByCreatedAtAsc(t.getId())))
        .toList();
  }

  /** Offers of a tender, ordered by status then ascending price. */
  @Transactional(readOnly = true)
  public List<OfferResponse> getOffers(UUID tenderId) {
    if (!tenderRepository.existsById(tenderId)) {
      throw new ResourceNotFoundException("Tender", tenderId);
    }
    return offerRepository.findByTenderIdOrderByStatusAscPriceAmountAsc(tenderId).stream()
        .map(OfferResponse::from)
        .toList();
  }

  /** Offers of a carrier across tenders, newest first; {@code status} null matches all. */
  @Transactional(readOnly = true)
  public List<OfferResponse> getCarrierOffers(UUID carrierId, OfferStatus status) {
    var offers =
        status == null
            ? offerRepository.findByCarrierIdOrderByCreatedAtDesc(carrierId)
            : offerRepository.findByCarrierIdAndStatusOrderByCreatedAtDesc(carrierId, status);
    return offers.stream().map(OfferResponse::from).toList();
  }

  private List<UUID> resolveInvitedCarriers(CreateTenderRequest request) {
    var requested = request.carrierIdsOrEmpty();
    if (request.brokerId() == null) {
      return requested;
    }
    var eligible = tierResolver.resolveTier(request.brokerId(), request.tier());
    if (requested.isEmpty()) {
      return eligible;
    }
    for (var carrierId : requested) {
      if (!eligible.contains(carrierId)) {
        throw new InvalidStateException(
            "Carrier not eligible",
            "Carrier "
                + carrierId
                + " is not an active tier "
                + request.tier()
                + " carrier of broker "
                + request.brokerId());
      }
    }
    return requested;
  }

  private Tender persist(
      CreateTenderRequest request,
      String tenderNumber,
      UUID cascadeRootId,
      boolean cascadeRoot,
      List<UUID> carrierIds) {
    var tender =
        new Tender(
            tenderNumber,
            request.orderId(),
            request.shipmentId(),
            request.brokerId(),
            request.mode(),
            request.tier(),
            request.parentTenderId(),
            request.offerDeadline());
    tender = tenderRepository.save(tender);
    if (cascadeRoot) {
      tender.joinCascade(tender.getId());
    } else if (cascadeRootId != null) {
      tender.joinCascade(cascadeRootId);
    }

    var offers = new ArrayList<TenderOffer>();
    for (var carrierId : new LinkedHashSet<>(carrierIds)) {
      offers.add(
          offerRepository.save(
              new TenderOffer(
                  tender.getId(),
                  carrierId,
                  properties.defaultCurrency(),
                  tender.getOfferDeadline())));
    }
    eventPublisher.tender(TenderEventType.TENDER_CREATED, tender);

    if (request.openImmediately()) {
      tender.open();
      eventPublisher.tender(TenderEventType.TENDER_OPENED, tender);
    }
    tender = tenderRepository.save(tender);

    log.info(
        "Created tender {} (tier {}, {}) with {} invited carrier(s), status {}",
        tender.getTenderNumber(),
        tender.getTier(),
        tender.getMode(),
        offers.size(),
        tender.getStatus());
    hookRegistry.publishPost(TenderHooks.AFTER_TENDER_CREATE, TenderResponse.from(tender, offers));
    return tender;
  }
}
