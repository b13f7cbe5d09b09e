package com.fourkites.webhook.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fourkites.webhook.scheduler.validation.JsonPayloadSize;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

/**
 * Body of schedule create and full update. Exactly one of {@code cron_definition} and {@code
 * interval_definition} must be set; that rule and the timer syntax are checked by the store.
 */
public record ScheduleRequest(
    @NotNull(message = "Frequency is required")
        @Min(value = 0, message = "Frequency cannot be negative")
        Integer frequency,
    @JsonProperty("cron_definition")
        @Size(max = 200, message = "Cron definition cannot exceed 200 characters")
        String cronDefinition,
    @JsonProperty("interval_definition")
        @Size(max = 200, message = "Interval definition cannot exceed 200 characters")
        String intervalDefinition,
    @NotBlank(message = "Endpoint is required")
        @Size(max = 500, message = "Endpoint cannot exceed 500 characters")
        @URL(message = "Endpoint must be a valid URL")
        String endpoint,
    @JsonPayloadSize(maxSizeKB = 64, message = "Payload size cannot exceed 64KB") JsonNode payload,
    @JsonProperty(value = "auth_token", access = JsonProperty.Access.WRITE_ONLY)
        @Size(max = 500, message = "Auth token cannot exceed 500 characters")
        String authToken) { }
