package io.b2mash.crewhours.reporting;

/** Display helpers for decimal hours. */
public final class HoursFormatter {

  private HoursFormatter() {}

  /**
   * Formats decimal hours as {@code H:MM}, rounding to the nearest whole minute: {@code 8.5 ->
   * "8:30"}, {@code 0.1 -> "0:06"}. Negative values keep a leading minus sign.
   */
  public static String format(double hours) {
    long totalMinutes = Math.round(Math.abs(hours) * 60);
    String sign = hours < 0 && totalMinutes > 0 ? "-" : "";
    return String.format("%s%d:%02d", sign, totalMinutes / 60, totalMinutes % 60);
  }

  public static double roundToQuarterHour(double hours) {
    return Math.round(hours * 4) / 4.0;
  }
}
