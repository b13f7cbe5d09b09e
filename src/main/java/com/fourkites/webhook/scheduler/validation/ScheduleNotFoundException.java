package com.fourkites.webhook.scheduler.validation;

import java.util.UUID;

public class ScheduleNotFoundException extends RuntimeException {

  private final UUID scheduleId;

  public ScheduleNotFoundException(UUID scheduleId) {
    super("Schedule not found: " + scheduleId);
    this.scheduleId = scheduleId;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }
}
