package io.b2mash.crewhours.worksegment;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class CrewHoursCalculatorTest {

  private static final Instant START = Instant.parse("2024-03-04T08:00:00Z");

  @Test
  void teamHours_multipliesElapsedHoursByTeamSize() {
    assertThat(CrewHoursCalculator.teamHours(START, START.plusSeconds(2 * 3600), 3))
        .isEqualTo(6.0);
  }

  @Test
  void teamHours_handlesFractionalIntervals() {
    assertThat(CrewHoursCalculator.teamHours(START, START.plusSeconds(90 * 60), 4))
        .isEqualTo(6.0);
  }

  @Test
  void teamHours_isZeroForEmptyTeam() {
    assertThat(CrewHoursCalculator.teamHours(START, START.plusSeconds(8 * 3600), 0)).isZero();
  }

  @Test
  void teamHours_endBeforeStartIsNegative() {
    assertThat(CrewHoursCalculator.teamHours(START, START.minusSeconds(3600), 2))
        .isEqualTo(-2.0);
  }

  @Test
  void elapsedHours_ignoresTeam() {
    assertThat(CrewHoursCalculator.elapsedHours(START, START.plusSeconds(45 * 60)))
        .isEqualTo(0.75);
  }
}
