package io.b2mash.tms.tendering.tender;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

/**
 * Singleton counter row backing tender numbers. Seeded by the initial migration, so allocation
 * never races on an insert.
 */
@Entity
@Table(name = "tender_counters")
public class TenderCounter {

  @Id private UUID id;

  @Column(name = "next_number", nullable = false)
  private int nextNumber = 1;

  @Column(name = "singleton", nullable = false)
  private boolean singleton = true;

  protected TenderCounter() {}

  public UUID getId() {
    return id;
  }

  public int getNextNumber() {
    return nextNumber;
  }

  /** Returns the current number and advances the counter. */
  public int takeNext() {
    return nextNumber++;
  }
}
