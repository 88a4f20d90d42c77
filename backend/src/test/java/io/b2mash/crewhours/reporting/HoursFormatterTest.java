package io.b2mash.crewhours.reporting;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HoursFormatterTest {

  @Test
  void format_rendersHoursAndMinutes() {
    assertThat(HoursFormatter.format(8.5)).isEqualTo("8:30");
    assertThat(HoursFormatter.format(42.5)).isEqualTo("42:30");
    assertThat(HoursFormatter.format(0)).isEqualTo("0:00");
  }

  @Test
  void format_roundsToNearestMinute() {
    assertThat(HoursFormatter.format(0.1)).isEqualTo("0:06");
    assertThat(HoursFormatter.format(12.1)).isEqualTo("12:06");
    assertThat(HoursFormatter.format(7.999)).isEqualTo("8:00");
  }

  @Test
  void format_prefixesNegativeHours() {
    assertThat(HoursFormatter.format(-1.5)).isEqualTo("-1:30");
    assertThat(HoursFormatter.format(-0.001)).isEqualTo("0:00");
  }

  @Test
  void roundToQuarterHour_snapsToNearestQuarter() {
    assertThat(HoursFormatter.roundToQuarterHour(7.1)).isEqualTo(7.0);
    assertThat(HoursFormatter.roundToQuarterHour(7.13)).isEqualTo(7.25);
    assertThat(HoursFormatter.roundToQuarterHour(7.375)).isEqualTo(7.5);
    assertThat(HoursFormatter.roundToQuarterHour(8.0)).isEqualTo(8.0);
  }
}
