package io.b2mash.crewhours.timeblock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.crewhours.exception.AlreadyClockedInException;
import io.b2mash.crewhours.exception.InvalidStateException;
import io.b2mash.crewhours.exception.NotClockedInException;
import io.b2mash.crewhours.exception.ResourceNotFoundException;
import io.b2mash.crewhours.lock.LockRegistry;
import io.b2mash.crewhours.worker.WorkerDirectory;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
class ClockServiceTest {

  private static final UUID WORKER_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2024-03-04T12:00:00Z");

  @Mock private WorkerDirectory workerDirectory;

  private InMemoryTimeBlockStore store;
  private ClockService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryTimeBlockStore();
    service = clockService(store, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void clockInThenOut_sameDayProducesOneEightHourBlock() {
    service.clockIn(WORKER_ID, at("2024-03-04T08:00:00Z"));
    var closed = service.clockOut(WORKER_ID, at("2024-03-04T16:00:00Z"));

    assertThat(store.all()).hasSize(1);
    assertThat(closed.getBlockNumber()).isEqualTo(1);
    assertThat(closed.getDate()).isEqualTo(LocalDate.of(2024, 3, 4));
    assertThat(closed.getHoursWorked()).isEqualTo(8.0);
    assertThat(closed.isActive()).isFalse();
  }

  @Test
  void twoCyclesSameDay_numberBlocksOneAndTwo() {
    service.clockIn(WORKER_ID, at("2024-03-04T07:00:00Z"));
    var first = service.clockOut(WORKER_ID, at("2024-03-04T10:00:00Z"));
    service.clockIn(WORKER_ID, at("2024-03-04T13:00:00Z"));
    var second = service.clockOut(WORKER_ID, at("2024-03-04T17:00:00Z"));

    assertThat(first.getBlockNumber()).isEqualTo(1);
    assertThat(first.getHoursWorked()).isEqualTo(3.0);
    assertThat(second.getBlockNumber()).isEqualTo(2);
    assertThat(second.getHoursWorked()).isEqualTo(4.0);
  }

  @Test
  void blockNumberingRestartsOnNewDay() {
    service.clockIn(WORKER_ID, at("2024-03-04T07:00:00Z"));
    service.clockOut(WORKER_ID, at("2024-03-04T10:00:00Z"));
    var nextDay = service.clockIn(WORKER_ID, at("2024-03-05T07:00:00Z"));

    assertThat(nextDay.getBlockNumber()).isEqualTo(1);
    assertThat(nextDay.getDate()).isEqualTo(LocalDate.of(2024, 3, 5));
  }

  @Test
  void clockIn_rejectedWhenAlreadyClockedIn() {
    service.clockIn(WORKER_ID, at("2024-03-04T08:00:00Z"));

    assertThatThrownBy(() -> service.clockIn(WORKER_ID, at("2024-03-04T09:00:00Z")))
        .isInstanceOf(AlreadyClockedInException.class);
    assertThat(store.all()).hasSize(1);
  }

  @Test
  void clockIn_rejectedWhenOpenBlockIsFromEarlierDay() {
    service.clockIn(WORKER_ID, at("2024-03-01T08:00:00Z"));

    assertThatThrownBy(() -> service.clockIn(WORKER_ID, at("2024-03-04T08:00:00Z")))
        .isInstanceOf(AlreadyClockedInException.class);
  }

  @Test
  void clockOut_withoutClockInFailsAndCreatesNothing() {
    assertThatThrownBy(() -> service.clockOut(WORKER_ID, at("2024-03-04T16:00:00Z")))
        .isInstanceOf(NotClockedInException.class);
    assertThat(store.all()).isEmpty();
  }

  @Test
  void clockOut_rejectedWhenActiveBlockHasNoClockInTime() {
    store.save(new TimeBlock(WORKER_ID, LocalDate.of(2024, 3, 4), 1, null));

    assertThatThrownBy(() -> service.clockOut(WORKER_ID, at("2024-03-04T16:00:00Z")))
        .isInstanceOf(InvalidStateException.class);
    assertThat(store.findActive(WORKER_ID)).isPresent();
  }

  @Test
  void clockOut_beforeClockInRecordsNegativeHours() {
    service.clockIn(WORKER_ID, at("2024-03-04T08:00:00Z"));
    var closed = service.clockOut(WORKER_ID, at("2024-03-04T06:30:00Z"));

    assertThat(closed.getHoursWorked()).isEqualTo(-1.5);
  }

  @Test
  void clockOut_acrossMidnightKeepsClockInDate() {
    service.clockIn(WORKER_ID, at("2024-03-04T22:00:00Z"));
    var closed = service.clockOut(WORKER_ID, at("2024-03-05T02:00:00Z"));

    assertThat(store.all()).hasSize(1);
    assertThat(closed.getDate()).isEqualTo(LocalDate.of(2024, 3, 4));
    assertThat(closed.getHoursWorked()).isEqualTo(4.0);
  }

  @Test
  void clockIn_usesClockWhenTimestampOmitted() {
    var block = service.clockIn(WORKER_ID, null);

    assertThat(block.getClockInTime()).isEqualTo(NOW);
    assertThat(block.getDate()).isEqualTo(LocalDate.of(2024, 3, 4));
  }

  @Test
  void clockIn_calendarDayFollowsConfiguredZone() {
    var newYork = clockService(store, Clock.fixed(NOW, ZoneId.of("America/New_York")));

    var block = newYork.clockIn(WORKER_ID, at("2024-03-05T02:00:00Z"));

    assertThat(block.getDate()).isEqualTo(LocalDate.of(2024, 3, 4));
  }

  @Test
  void clockIn_unknownWorkerPropagatesNotFound() {
    when(workerDirectory.requireActiveWorker(WORKER_ID))
        .thenThrow(new ResourceNotFoundException("Worker", WORKER_ID));

    assertThatThrownBy(() -> service.clockIn(WORKER_ID, at("2024-03-04T08:00:00Z")))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThat(store.all()).isEmpty();
  }

  @Test
  void clockIn_inactiveWorkerRejected() {
    when(workerDirectory.requireActiveWorker(WORKER_ID))
        .thenThrow(new InvalidStateException("Worker inactive", "inactive"));

    assertThatThrownBy(() -> service.clockIn(WORKER_ID, at("2024-03-04T08:00:00Z")))
        .isInstanceOf(InvalidStateException.class);
    assertThat(store.all()).isEmpty();
  }

  @Test
  void clockIn_uniqueConstraintViolationReportedAsAlreadyClockedIn() {
    var failingStore = mock(TimeBlockStore.class);
    when(failingStore.findActive(WORKER_ID)).thenReturn(Optional.empty());
    when(failingStore.save(any(TimeBlock.class)))
        .thenThrow(new DataIntegrityViolationException("uq_time_blocks_active_worker"));
    var racingService = clockService(failingStore, Clock.fixed(NOW, ZoneOffset.UTC));

    assertThatThrownBy(() -> racingService.clockIn(WORKER_ID, at("2024-03-04T08:00:00Z")))
        .isInstanceOf(AlreadyClockedInException.class);
  }

  private ClockService clockService(TimeBlockStore timeBlockStore, Clock clock) {
    return new ClockService(
        timeBlockStore,
        workerDirectory,
        new LockRegistry(),
        TransactionOperations.withoutTransaction(),
        clock);
  }

  private static Instant at(String isoInstant) {
    return Instant.parse(isoInstant);
  }
}
