package io.b2mash.crewhours.worksegment;

import java.time.Duration;
import java.time.Instant;

/**
 * Team-multiplied labor hours. The declared team size is the multiplier, whatever the length of the
 * member list. Interval ordering is not validated, so an end before the start yields negative
 * hours.
 */
public final class CrewHoursCalculator {

  private static final double MILLIS_PER_HOUR = 3_600_000.0;

  private CrewHoursCalculator() {}

  public static double elapsedHours(Instant start, Instant end) {
    return Duration.between(start, end).toMillis() / MILLIS_PER_HOUR;
  }

  public static double teamHours(Instant start, Instant end, int teamSize) {
    if (teamSize == 0) {
      return 0.0;
    }
    return elapsedHours(start, end) * teamSize;
  }
}
