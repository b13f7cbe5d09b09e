package com.fourkites.webhook.scheduler.timer;

/**
 * A validated 5-field crontab definition. Each component keeps the field text exactly as it was
 * written, so {@code "25 * * * *"} yields {@code minute = "25"}.
 */
public record CrontabSpec(
    String minute, String hour, String dayOfWeek, String dayOfMonth, String monthOfYear) {

  /** Standard field order: minute hour day-of-month month day-of-week. */
  public String toExpression() {
    return String.join(" ", minute, hour, dayOfMonth, monthOfYear, dayOfWeek);
  }
}
