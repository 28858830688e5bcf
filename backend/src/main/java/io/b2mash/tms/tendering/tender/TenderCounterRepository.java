package io.b2mash.tms.tendering.tender;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;

public interface TenderCounterRepository extends JpaRepository<TenderCounter, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT c FROM TenderCounter c WHERE c.singleton = true")
  Optional<TenderCounter> findCounterForUpdate();
}
