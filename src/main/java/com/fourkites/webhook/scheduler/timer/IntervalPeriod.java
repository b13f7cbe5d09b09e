package com.fourkites.webhook.scheduler.timer;

import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.stream.Collectors;

/** Periods accepted in an interval definition such as {@code 1 minutes}. */
public enum IntervalPeriod {
  DAYS("days", ChronoUnit.DAYS),
  HOURS("hours", ChronoUnit.HOURS),
  MINUTES("minutes", ChronoUnit.MINUTES),
  SECONDS("seconds", ChronoUnit.SECONDS),
  MICROSECONDS("microseconds", ChronoUnit.MICROS);

  /** Comma separated list used in validation messages. */
  public static final String ACCEPTED =
      Arrays.stream(values()).map(IntervalPeriod::value).collect(Collectors.joining(", "));

  private final String value;
  private final ChronoUnit unit;

  IntervalPeriod(String value, ChronoUnit unit) {
    this.value = value;
    this.unit = unit;
  }

  public String value() {
    return value;
  }

  public ChronoUnit unit() {
    return unit;
  }

  /** Returns the period for its lowercase name, or {@code null} when the name is unknown. */
  public static IntervalPeriod fromValue(String value) {
    for (IntervalPeriod period : values()) {
      if (period.value.equals(value)) {
        return period;
      }
    }
    return null;
  }
}
