package io.b2mash.tms.tendering.tender;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that closes OPEN tenders whose offer deadline has passed. Each tender is closed in
 * its own transaction, so one failing close (for example a failed cascade escalation) does not
 * block the others; it is retried on the next run.
 */
@Component
public class TenderDeadlineProcessor {

  private static final Logger log = LoggerFactory.getLogger(TenderDeadlineProcessor.class);

  private final TenderRepository tenderRepository;
  private final TenderLifecycleService lifecycleService;

  public TenderDeadlineProcessor(
      TenderRepository tenderRepository, TenderLifecycleService lifecycleService) {
    this.tenderRepository = tenderRepository;
    this.lifecycleService = lifecycleService;
  }

  @Scheduled(
      fixedRateString = "${tendering.deadline-sweep.interval:60000}",
      initialDelayString = "${tendering.deadline-sweep.initial-delay:30000}")
  public void scheduledSweep() {
    closeExpiredTenders();
  }

  /** Returns the number of tenders closed. */
  public int closeExpiredTenders() {
    var now = Instant.now();
    var expired = tenderRepository.findByStatusAndOfferDeadlineBefore(TenderStatus.OPEN, now);
    int closed = 0;

    for (var tender : expired) {
      try {
        if (lifecycleService.closeIfExpired(tender.getId(), now)) {
          closed++;
        }
      } catch (Exception e) {
        log.error("Deadline sweep failed to close tender {}", tender.getTenderNumber(), e);
      }
    }

    if (closed > 0) {
      log.info("Deadline sweep completed: {} of {} expired tenders closed", closed, expired.size());
    } else {
      log.debug("Deadline sweep completed: no tenders closed");
    }
    return closed;
  }
}
