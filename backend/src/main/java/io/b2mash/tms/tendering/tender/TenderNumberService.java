package io.b2mash.tms.tendering.tender;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generates sequential tender numbers from the singleton {@code tender_counters} row.
 *
 * <p>The row is read under a pessimistic lock, so concurrent allocations serialize. Numbers are
 * gap-free: a rolled-back cascade also rolls back its counter increment. Format: "TND-" +
 * zero-padded 6-digit number.
 */
@Service
public class TenderNumberService implements TenderNumberGenerator {

  private final TenderCounterRepository counterRepository;

  public TenderNumberService(TenderCounterRepository counterRepository) {
    this.counterRepository = counterRepository;
  }

  @Override
  @Transactional
  public String nextNumber() {
    var counter =
        counterRepository
            .findCounterForUpdate()
            .orElseThrow(() -> new IllegalStateException("tender_counters row is missing"));
    int number = counter.takeNext();
    counterRepository.save(counter);
    return String.format("TND-%06d", number);
  }
}
