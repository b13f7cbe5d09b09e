package com.fourkites.webhook.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fourkites.webhook.scheduler.model.ScheduleFailure;
import java.time.LocalDateTime;
import java.util.UUID;

public record ScheduleFailureResponse(
    @JsonProperty("failure_id") UUID failureId,
    @JsonProperty("schedule_id") UUID scheduleId,
    String endpoint,
    @JsonProperty("status_code") Integer statusCode,
    int attempts,
    @JsonProperty("failure_reason") String failureReason,
    @JsonProperty("initiated_at") LocalDateTime initiatedAt) {
  public static ScheduleFailureResponse from(ScheduleFailure f) {
    return new ScheduleFailureResponse(
        f.getFailureId(),
        f.getScheduleId(),
        f.getEndpoint(),
        f.getStatusCode(),
        f.getAttempts(),
        f.getFailureReason(),
        f.getInitiatedAt());
  }
}
