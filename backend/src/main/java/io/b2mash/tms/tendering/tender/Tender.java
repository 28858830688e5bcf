package io.b2mash.tms.tendering.tender;

import io.b2mash.tms.tendering.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One round of competitive bidding for an order, scoped to one tier of a broker's carrier network.
 *
 * <p>Lifecycle: DRAFT → OPEN → CLOSED → AWARDED, with CANCELLED reachable from any non-terminal
 * status. Offers reference the tender by ID ({@link TenderOffer#getTenderId()}).
 *
 * <p>Cascade linkage: {@code parentTenderId} points at the previous tier (sequential) or at the
 * cascade root (parallel); {@code cascadeRootId} is shared by every tender of one cascade and
 * equals the root's own ID on the root. Both are null for a standalone tender.
 */
@Entity
@Table(name = "tenders")
public class Tender {

  private static final Set<TenderStatus> TERMINAL_STATUSES =
      Set.of(TenderStatus.AWARDED, TenderStatus.CANCELLED);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tender_number", nullable = false, length = 40)
  private String tenderNumber;

  @Column(name = "order_id", nullable = false)
  private UUID orderId;

  @Column(name = "shipment_id")
  private UUID shipmentId;

  @Column(name = "broker_id")
  private UUID brokerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TenderStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "tender_mode", nullable = false, length = 20)
  private TenderMode mode;

  @Column(name = "tier", nullable = false)
  private int tier;

  @Column(name = "parent_tender_id")
  private UUID parentTenderId;

  @Column(name = "cascade_root_id")
  private UUID cascadeRootId;

  @Column(name = "offer_deadline", nullable = false)
  private Instant offerDeadline;

  // --- Award result ---

  @Column(name = "awarded_offer_id")
  private UUID awardedOfferId;

  @Column(name = "awarded_carrier_id")
  private UUID awardedCarrierId;

  // --- Lifecycle timestamps ---

  @Column(name = "opened_at")
  private Instant openedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Column(name = "awarded_at")
  private Instant awardedAt;

  @Column(name = "cancelled_at")
  private Instant cancelledAt;

  @Column(name = "cancel_reason", length = 500)
  private String cancelReason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected Tender() {}

  public Tender(
      String tenderNumber,
      UUID orderId,
      UUID shipmentId,
      UUID brokerId,
      TenderMode mode,
      int tier,
      UUID parentTenderId,
      Instant offerDeadline) {
    if (tier < 0) {
      throw new IllegalArgumentException("tier must not be negative: " + tier);
    }
    this.tenderNumber = Objects.requireNonNull(tenderNumber, "tenderNumber must not be null");
    this.orderId = Objects.requireNonNull(orderId, "orderId must not be null");
    this.mode = Objects.requireNonNull(mode, "mode must not be null");
    this.offerDeadline = Objects.requireNonNull(offerDeadline, "offerDeadline must not be null");
    this.shipmentId = shipmentId;
    this.brokerId = brokerId;
    this.tier = tier;
    this.parentTenderId = parentTenderId;
    this.status = TenderStatus.DRAFT;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  // --- Lifecycle methods ---

  /** Starts accepting offers. Only valid from DRAFT. */
  public void open() {
    requireStatus(Set.of(TenderStatus.DRAFT), "open");
    this.status = TenderStatus.OPEN;
    this.openedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Stops accepting offers. Only valid from OPEN. */
  public void close() {
    requireStatus(Set.of(TenderStatus.OPEN), "close");
    this.status = TenderStatus.CLOSED;
    this.closedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Records the winning offer. Only valid from CLOSED. */
  public void markAwarded(UUID offerId, UUID carrierId) {
    requireStatus(Set.of(TenderStatus.CLOSED), "award");
    this.awardedOfferId = Objects.requireNonNull(offerId, "offerId must not be null");
    this.awardedCarrierId = Objects.requireNonNull(carrierId, "carrierId must not be null");
    this.status = TenderStatus.AWARDED;
    this.awardedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Cancels the tender. Valid from any non-terminal status. */
  public void cancel(String reason) {
    if (isTerminal()) {
      throw InvalidStateException.forStatus("tender", "cancel", this.status);
    }
    this.status = TenderStatus.CANCELLED;
    this.cancelReason = reason;
    this.cancelledAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Moves the offer deadline later. Only valid while DRAFT or OPEN; the new deadline must lie after
   * both {@code now} and the current deadline.
   */
  public void extendDeadline(Instant newDeadline, Instant now) {
    requireStatus(Set.of(TenderStatus.DRAFT, TenderStatus.OPEN), "extend deadline of");
    Objects.requireNonNull(newDeadline, "newDeadline must not be null");
    if (!newDeadline.isAfter(offerDeadline) || !newDeadline.isAfter(now)) {
      throw new InvalidStateException(
          "Invalid offer deadline",
          "New deadline " + newDeadline + " must be after " + offerDeadline + " and in the future");
    }
    this.offerDeadline = newDeadline;
    this.updatedAt = Instant.now();
  }

  /** Links this tender to a cascade. Not guarded: set once while the cascade is being built. */
  public void joinCascade(UUID cascadeRootId) {
    this.cascadeRootId = Objects.requireNonNull(cascadeRootId, "cascadeRootId must not be null");
    this.updatedAt = Instant.now();
  }

  // --- Guards ---

  /** Returns true if offers submitted at {@code now} are past the deadline. */
  public boolean isDeadlinePassed(Instant now) {
    return now.isAfter(offerDeadline);
  }

  /** Returns true if the tender is AWARDED or CANCELLED. */
  public boolean isTerminal() {
    return TERMINAL_STATUSES.contains(this.status);
  }

  public boolean isCascadeRoot() {
    return id != null && id.equals(cascadeRootId);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getTenderNumber() {
    return tenderNumber;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public UUID getShipmentId() {
    return shipmentId;
  }

  public UUID getBrokerId() {
    return brokerId;
  }

  public TenderStatus getStatus() {
    return status;
  }

  public TenderMode getMode() {
    return mode;
  }

  public int getTier() {
    return tier;
  }

  public UUID getParentTenderId() {
    return parentTenderId;
  }

  public UUID getCascadeRootId() {
    return cascadeRootId;
  }

  public Instant getOfferDeadline() {
    return offerDeadline;
  }

  public UUID getAwardedOfferId() {
    return awardedOfferId;
  }

  public UUID getAwardedCarrierId() {
    return awardedCarrierId;
  }

  public Instant getOpenedAt() {
    return openedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }

  public Instant getAwardedAt() {
    return awardedAt;
  }

  public Instant getCancelledAt() {
    return cancelledAt;
  }

  public String getCancelReason() {
    return cancelReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  // --- Private helpers ---

  private void requireStatus(Set<TenderStatus> allowedStatuses, String action) {
    if (!allowedStatuses.contains(this.status)) {
      throw InvalidStateException.forStatus("tender", action, this.status);
    }
  }
}
