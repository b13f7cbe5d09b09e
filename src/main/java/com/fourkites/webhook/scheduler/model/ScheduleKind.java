package com.fourkites.webhook.scheduler.model;

/** The two timer families a schedule can be bound to. */
public enum ScheduleKind {
  CRONTAB("crontab"),
  INTERVAL("interval");

  private final String value;

  ScheduleKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ScheduleKind fromValue(String value) {
    if (value != null) {
      for (ScheduleKind kind : values()) {
        if (kind.value.equalsIgnoreCase(value.trim())) {
          return kind;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unknown schedule type: " + value + " (expected crontab or interval)");
  }
}
