package io.b2mash.tms.tendering.tender;

import io.b2mash.tms.tendering.exception.InvalidStateException;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A carrier's bid against one tender.
 *
 * <p>Offers are pre-provisioned as PENDING placeholders for every invited carrier (zero price,
 * valid until the tender deadline) and move PENDING → SUBMITTED → ACCEPTED | REJECTED | WITHDRAWN.
 */
@Entity
@Table(name = "tender_offers")
public class TenderOffer {

  private static final Set<OfferStatus> TERMINAL_STATUSES =
      Set.of(OfferStatus.ACCEPTED, OfferStatus.REJECTED, OfferStatus.WITHDRAWN);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tender_id", nullable = false)
  private UUID tenderId;

  @Column(name = "carrier_id", nullable = false)
  private UUID carrierId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OfferStatus status;

  @Column(name = "price_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal priceAmount;

  @Column(name = "price_currency", nullable = false, length = 3)
  private String priceCurrency;

  @Column(name = "valid_until", nullable = false)
  private Instant validUntil;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "tender_offer_conditions", joinColumns = @JoinColumn(name = "offer_id"))
  @OrderColumn(name = "sort_order")
  @Column(name = "condition_text", nullable = false, length = 500)
  private List<String> conditions = new ArrayList<>();

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "decided_at")
  private Instant decidedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected TenderOffer() {}

  /** Creates a PENDING placeholder for an invited carrier. */
  public TenderOffer(UUID tenderId, UUID carrierId, String currency, Instant validUntil) {
    this.tenderId = Objects.requireNonNull(tenderId, "tenderId must not be null");
    this.carrierId = Objects.requireNonNull(carrierId, "carrierId must not be null");
    this.priceCurrency = Objects.requireNonNull(currency, "currency must not be null");
    this.validUntil = Objects.requireNonNull(validUntil, "validUntil must not be null");
    this.priceAmount = BigDecimal.ZERO;
    this.status = OfferStatus.PENDING;
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

  /** Records the carrier's bid. Only valid from PENDING. */
  public void submit(
      BigDecimal priceAmount,
      String priceCurrency,
      Instant validUntil,
      List<String> conditions,
      Instant submittedAt) {
    requireStatus(Set.of(OfferStatus.PENDING), "submit");
    this.priceAmount = Objects.requireNonNull(priceAmount, "priceAmount must not be null");
    this.priceCurrency = Objects.requireNonNull(priceCurrency, "priceCurrency must not be null");
    this.validUntil = Objects.requireNonNull(validUntil, "validUntil must not be null");
    this.conditions.clear();
    if (conditions != null) {
      this.conditions.addAll(conditions);
    }
    this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt must not be null");
    this.status = OfferStatus.SUBMITTED;
    this.updatedAt = Instant.now();
  }

  /** Only valid from SUBMITTED. */
  public void accept() {
    decide(OfferStatus.ACCEPTED, "accept");
  }

  /** Only valid from SUBMITTED. */
  public void reject() {
    decide(OfferStatus.REJECTED, "reject");
  }

  /** Only valid from SUBMITTED. */
  public void withdraw() {
    decide(OfferStatus.WITHDRAWN, "withdraw");
  }

  public boolean isTerminal() {
    return TERMINAL_STATUSES.contains(this.status);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getTenderId() {
    return tenderId;
  }

  public UUID getCarrierId() {
    return carrierId;
  }

  public OfferStatus getStatus() {
    return status;
  }

  public BigDecimal getPriceAmount() {
    return priceAmount;
  }

  public String getPriceCurrency() {
    return priceCurrency;
  }

  public Instant getValidUntil() {
    return validUntil;
  }

  public List<String> getConditions() {
    return List.copyOf(conditions);
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getDecidedAt() {
    return decidedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  // --- Private helpers ---

  /** Follows a deadline extension. Only placeholders still PENDING carry the tender deadline. */
  public void extendValidity(Instant validUntil) {
    requireStatus(Set.of(OfferStatus.PENDING), "extend");
    this.validUntil = Objects.requireNonNull(validUntil, "validUntil must not be null");
  }

  private void decide(OfferStatus target, String action) {
    requireStatus(Set.of(OfferStatus.SUBMITTED), action);
    this.status = target;
    this.decidedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  private void requireStatus(Set<OfferStatus> allowedStatuses, String action) {
    if (!allowedStatuses.contains(this.status)) {
      throw InvalidStateException.forStatus("offer", action, this.status);
    }
  }
}
