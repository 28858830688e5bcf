package io.b2mash.tms.tendering.tender;

import static io.b2mash.tms.tendering.testutil.TestTenderFactory.draftTender;
import static io.b2mash.tms.tendering.testutil.TestTenderFactory.expireDeadline;
import static io.b2mash.tms.tendering.testutil.TestTenderFactory.openTender;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.tms.tendering.carrier.InMemoryCarrierRelationSource;
import io.b2mash.tms.tendering.event.TenderEvent;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.logistics.InMemoryOrderDirectory;
import io.b2mash.tms.tendering.testutil.TestNetwork;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

@SpringBootTest
@ActiveProfiles("test")
@RecordApplicationEvents
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TenderDeadlineProcessorTest {

  @Autowired private TenderDeadlineProcessor deadlineProcessor;
  @Autowired private TenderService tenderService;
  @Autowired private TenderRepository tenderRepository;
  @Autowired private InMemoryCarrierRelationSource relationSource;
  @Autowired private InMemoryOrderDirectory orderDirectory;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private ApplicationEvents events;

  private TestNetwork network() {
    return TestNetwork.create(relationSource, orderDirectory, 1);
  }

  private TenderStatus statusOf(UUID tenderId) {
    return tenderRepository.findById(tenderId).orElseThrow().getStatus();
  }

  @Test
  void closeExpiredTenders_openPastDeadline_closes() {
    var tender = tenderService.createTender(openTender(network()));
    expireDeadline(jdbcTemplate, tender.id());

    int closed = deadlineProcessor.closeExpiredTenders();

    assertThat(closed).isGreaterThanOrEqualTo(1);
    assertThat(statusOf(tender.id())).isEqualTo(TenderStatus.CLOSED);
    assertThat(
            events.stream(TenderEvent.class)
                .filter(e -> e.tenderId().equals(tender.id()))
                .filter(e -> e.type() == TenderEventType.TENDER_CLOSED)
                .count())
        .isEqualTo(1);
  }

  @Test
  void closeExpiredTenders_deadlineAhead_leavesOpen() {
    var tender = tenderService.createTender(openTender(network()));

    deadlineProcessor.closeExpiredTenders();

    assertThat(statusOf(tender.id())).isEqualTo(TenderStatus.OPEN);
  }

  @Test
  void closeExpiredTenders_draftPastDeadline_isIgnored() {
    var tender = tenderService.createTender(draftTender(network()));
    expireDeadline(jdbcTemplate, tender.id());

    deadlineProcessor.closeExpiredTenders();

    assertThat(statusOf(tender.id())).isEqualTo(TenderStatus.DRAFT);
  }

  @Test
  void closeExpiredTenders_secondRun_doesNotCloseAgain() {
    var tender = tenderService.createTender(openTender(network()));
    expireDeadline(jdbcTemplate, tender.id());
    deadlineProcessor.closeExpiredTenders();

    deadlineProcessor.closeExpiredTenders();

    assertThat(
            events.stream(TenderEvent.class)
                .filter(e -> e.tenderId().equals(tender.id()))
                .filter(e -> e.type() == TenderEventType.TENDER_CLOSED)
                .count())
        .isEqualTo(1);
  }
}
