package com.fourkites.webhook.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fourkites.webhook.scheduler.model.Schedule;
import java.time.LocalDateTime;
import java.util.UUID;

public record ScheduleResponse(
    UUID id,
    int frequency,
    @JsonProperty("cron_definition") String cronDefinition,
    @JsonProperty("interval_definition") String intervalDefinition,
    @JsonProperty("crontab_timer_id") Long crontabTimerId,
    @JsonProperty("interval_timer_id") Long intervalTimerId,
    String endpoint,
    JsonNode payload,
    @JsonProperty("next_send_at") LocalDateTime nextSendAt,
    int triggered,
    boolean enabled,
    @JsonProperty("created_at") LocalDateTime createdAt,
    @JsonProperty("updated_at") LocalDateTime updatedAt,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("updated_by") String updatedBy) {
  public static ScheduleResponse from(Schedule s) {
    return new ScheduleResponse(
        s.getScheduleId(),
        s.getFrequency(),
        s.getCronDefinition(),
        s.getIntervalDefinition(),
        s.getCrontabTimer() != null ? s.getCrontabTimer().getId() : null,
        s.getIntervalTimer() != null ? s.getIntervalTimer().getId() : null,
        s.getEndpoint(),
        s.getPayload(),
        s.getNextSendAt(),
        s.getTriggered(),
        s.isEnabled(),
        s.getCreatedAt(),
        s.getUpdatedAt(),
        s.getCreatedBy(),
        s.getUpdatedBy());
  }
}
