package io.b2mash.crewhours.config;

import java.math.BigDecimal;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Time tracking rules.
 *
 * @param zone zone whose local midnight delimits a calendar day for time blocks
 * @param dailyOvertimeThresholdHours hours per day beyond which daily overtime accrues
 * @param weeklyOvertimeThresholdHours hours per Monday-Sunday week beyond which overtime is paid
 * @param overtimeRateMultiplier factor applied to the hourly rate for overtime cost estimates
 */
@ConfigurationProperties(prefix = "timetracking")
public record TimeTrackingProperties(
    @DefaultValue("UTC") ZoneId zone,
    @DefaultValue("8") double dailyOvertimeThresholdHours,
    @DefaultValue("40") double weeklyOvertimeThresholdHours,
    @DefaultValue("1.5") BigDecimal overtimeRateMultiplier) {

  public static TimeTrackingProperties defaults() {
    return new TimeTrackingProperties(ZoneId.of("UTC"), 8.0, 40.0, new BigDecimal("1.5"));
  }
}
