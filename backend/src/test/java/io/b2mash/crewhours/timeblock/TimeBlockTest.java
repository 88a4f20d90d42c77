package io.b2mash.crewhours.timeblock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.b2mash.crewhours.exception.InvalidStateException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TimeBlockTest {

  private static final UUID WORKER_ID = UUID.randomUUID();
  private static final LocalDate DAY = LocalDate.of(2024, 3, 4);
  private static final Instant EIGHT_AM = Instant.parse("2024-03-04T08:00:00Z");

  @Test
  void newBlockIsOpenWithZeroHours() {
    var block = new TimeBlock(WORKER_ID, DAY, 1, EIGHT_AM);

    assertThat(block.isActive()).isTrue();
    assertThat(block.getHoursWorked()).isZero();
    assertThat(block.getClockOutTime()).isNull();
    assertThat(block.getBlockNumber()).isEqualTo(1);
  }

  @Test
  void weekFieldsFollowIsoWeekOfBlockDate() {
    var monday = new TimeBlock(WORKER_ID, LocalDate.of(2024, 1, 1), 1, EIGHT_AM);
    var sunday = new TimeBlock(WORKER_ID, LocalDate.of(2023, 1, 1), 1, EIGHT_AM);

    assertThat(monday.getWeekNumber()).isEqualTo(1);
    assertThat(monday.getWeekYear()).isEqualTo(2024);
    assertThat(sunday.getWeekNumber()).isEqualTo(52);
    assertThat(sunday.getWeekYear()).isEqualTo(2022);
  }

  @Test
  void close_computesHoursFromClockInToClockOut() {
    var block = new TimeBlock(WORKER_ID, DAY, 1, EIGHT_AM);

    block.close(Instant.parse("2024-03-04T16:00:00Z"));

    assertThat(block.isActive()).isFalse();
    assertThat(block.getHoursWorked()).isEqualTo(8.0);
    assertThat(block.getClockOutTime()).isEqualTo(Instant.parse("2024-03-04T16:00:00Z"));
  }

  @Test
  void close_keepsFractionalHours() {
    var block = new TimeBlock(WORKER_ID, DAY, 1, EIGHT_AM);

    block.close(Instant.parse("2024-03-04T08:06:00Z"));

    assertThat(block.getHoursWorked()).isCloseTo(0.1, within(1e-9));
  }

  @Test
  void close_beforeClockInYieldsNegativeHours() {
    var block = new TimeBlock(WORKER_ID, DAY, 1, EIGHT_AM);

    block.close(Instant.parse("2024-03-04T07:00:00Z"));

    assertThat(block.getHoursWorked()).isEqualTo(-1.0);
  }

  @Test
  void close_twiceIsRejected() {
    var block = new TimeBlock(WORKER_ID, DAY, 1, EIGHT_AM);
    block.close(Instant.parse("2024-03-04T16:00:00Z"));

    assertThatThrownBy(() -> block.close(Instant.parse("2024-03-04T17:00:00Z")))
        .isInstanceOf(InvalidStateException.class);
    assertThat(block.getHoursWorked()).isEqualTo(8.0);
  }

  @Test
  void close_withoutClockInTimeIsRejected() {
    var block = new TimeBlock(WORKER_ID, DAY, 1, null);

    assertThatThrownBy(() -> block.close(EIGHT_AM)).isInstanceOf(InvalidStateException.class);
    assertThat(block.isActive()).isTrue();
  }

  @Test
  void elapsedHours_projectsOpenBlockWithoutStoringIt() {
    var block = new TimeBlock(WORKER_ID, DAY, 1, EIGHT_AM);

    double elapsed = block.elapsedHours(Instant.parse("2024-03-04T10:30:00Z"));

    assertThat(elapsed).isEqualTo(2.5);
    assertThat(block.getHoursWorked()).isZero();
  }

  @Test
  void elapsedHours_closedBlockReturnsStoredTotal() {
    var block = new TimeBlock(WORKER_ID, DAY, 1, EIGHT_AM);
    block.close(Instant.parse("2024-03-04T11:00:00Z"));

    assertThat(block.elapsedHours(Instant.parse("2024-03-05T00:00:00Z"))).isEqualTo(3.0);
  }
}
