package com.fourkites.webhook.scheduler.model;

/**
 * Identifies one timer entity, as carried by a tick. The compact text form is {@code
 * <kind>:<lookupId>}, e.g. {@code crontab:1}.
 */
public record TimerRef(ScheduleKind kind, long lookupId) {

  public static TimerRef parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Timer reference is required");
    }
    int colon = text.indexOf(':');
    if (colon <= 0 || colon == text.length() - 1) {
      throw new IllegalArgumentException("Invalid timer reference: " + text);
    }
    ScheduleKind kind = ScheduleKind.fromValue(text.substring(0, colon));
    try {
      return new TimerRef(kind, Long.parseLong(text.substring(colon + 1).trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid timer lookup id in: " + text, e);
    }
  }

  @Override
  public String toString() {
    return kind.value() + ":" + lookupId;
  }
}
