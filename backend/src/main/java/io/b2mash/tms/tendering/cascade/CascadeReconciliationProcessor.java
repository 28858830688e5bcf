package io.b2mash.tms.tendering.cascade;

import io.b2mash.tms.tendering.audit.AuditSources;
import io.b2mash.tms.tendering.tender.TenderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that re-drives escalation for closed sequential tiers whose next tier is still
 * DRAFT. Covers closes whose in-transaction escalation was lost, e.g. tiers closed before a
 * restart or by another writer.
 */
@Component
public class CascadeReconciliationProcessor {

  private static final Logger log = LoggerFactory.getLogger(CascadeReconciliationProcessor.class);

  private final TenderRepository tenderRepository;
  private final CascadeEscalationService escalationService;

  public CascadeReconciliationProcessor(
      TenderRepository tenderRepository, CascadeEscalationService escalationService) {
    this.tenderRepository = tenderRepository;
    this.escalationService = escalationService;
  }

  @Scheduled(
      fixedRateString = "${tendering.cascade.reconcile-interval:60000}",
      initialDelayString = "${tendering.cascade.reconcile-initial-delay:45000}")
  public void scheduledReconcile() {
    reconcile();
  }

  /** Returns the number of tiers opened. */
  public int reconcile() {
    var candidates = tenderRepository.findClosedSequentialWithDraftChild();
    int escalated = 0;

    for (var tenderId : candidates) {
      try {
        if (escalationService.escalateFrom(tenderId, AuditSources.SWEEP).isPresent()) {
          escalated++;
        }
      } catch (Exception e) {
        log.error("Cascade reconciliation failed for tender {}", tenderId, e);
      }
    }

    if (escalated > 0) {
      log.info(
          "Cascade reconciliation completed: {} tier(s) opened from {} candidate(s)",
          escalated,
          candidates.size());
    } else {
      log.debug("Cascade reconciliation completed: nothing to escalate");
    }
    return escalated;
  }
}
