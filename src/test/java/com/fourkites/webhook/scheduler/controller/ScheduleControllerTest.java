package com.fourkites.webhook.scheduler.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fourkites.webhook.scheduler.dto.ScheduleRequest;
import com.fourkites.webhook.scheduler.model.CrontabTimer;
import com.fourkites.webhook.scheduler.model.Schedule;
import com.fourkites.webhook.scheduler.model.ScheduleFailure;
import com.fourkites.webhook.scheduler.service.ScheduleFiringService;
import com.fourkites.webhook.scheduler.service.ScheduleService;
import com.fourkites.webhook.scheduler.validation.ScheduleNotFoundException;
import com.fourkites.webhook.scheduler.validation.ScheduleValidationException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ScheduleController.class)
class ScheduleControllerTest {

  private static final UUID ID = UUID.fromString("8d3c6a52-6a1e-4c55-9a53-2f1c0e7b9a10");

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @MockBean private ScheduleService scheduleService;
  @MockBean private ScheduleFiringService firingService;

  @Test
  void createReturnsCreatedScheduleWithoutToken() throws Exception {
    when(scheduleService.create(any(ScheduleRequest.class), eq("alice"))).thenReturn(schedule());

    mockMvc
        .perform(
            post("/api/v1/schedule")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User", "alice")
                .content(
                    "{\"frequency\":2,\"cron_definition\":\"25 * * * *\","
                        + "\"endpoint\":\"http://x/trigger\",\"payload\":{\"run\":1},"
                        + "\"auth_token\":\"secret\"}"))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/v1/schedule/" + ID))
        .andExpect(jsonPath("$.id").value(ID.toString()))
        .andExpect(jsonPath("$.cron_definition").value("25 * * * *"))
        .andExpect(jsonPath("$.crontab_timer_id").value(1))
        .andExpect(jsonPath("$.next_send_at").value("2024-03-01T10:25:00"))
        .andExpect(jsonPath("$.enabled").value(true))
        .andExpect(jsonPath("$.auth_token").doesNotExist());
  }

  @Test
  void timerSyntaxErrorsAreReturnedByField() throws Exception {
    when(scheduleService.create(any(ScheduleRequest.class), isNull()))
        .thenThrow(
            ScheduleValidationException.of(
                "cron_definition", "improper number of cron entries specified; got 4 need 5"));

    mockMvc
        .perform(
            post("/api/v1/schedule")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"frequency\":0,\"cron_definition\":\"* * * *\","
                        + "\"endpoint\":\"http://x/trigger\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.cron_definition")
                .value(hasItem("improper number of cron entries specified; got 4 need 5")));
  }

  @Test
  void bodyValidationRejectsMissingEndpointAndNegativeFrequency() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/schedule")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"frequency\":-1,\"interval_definition\":\"1 minutes\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
        .andExpect(jsonPath("$.fieldErrors.endpoint").value("Endpoint is required"))
        .andExpect(jsonPath("$.fieldErrors.frequency").value("Frequency cannot be negative"));

    verifyNoInteractions(scheduleService);
  }

  @Test
  void arrayPayloadIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/schedule")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"frequency\":1,\"cron_definition\":\"25 * * * *\","
                        + "\"endpoint\":\"http://x/trigger\",\"payload\":[1,2]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.fieldErrors.payload").value("Webhook payload must be a JSON object"));

    verifyNoInteractions(scheduleService);
  }

  @Test
  void malformedJsonIsRejected() throws Exception {
    mockMvc
        .perform(post("/api/v1/schedule").contentType(MediaType.APPLICATION_JSON).content("{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
  }

  @Test
  void unknownScheduleIsNotFound() throws Exception {
    when(scheduleService.findById(ID)).thenThrow(new ScheduleNotFoundException(ID));

    mockMvc
        .perform(get("/api/v1/schedule/{id}", ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("NOT_FOUND"))
        .andExpect(jsonPath("$.id").value(ID.toString()));
  }

  @Test
  void nonUuidIdIsRejected() throws Exception {
    mockMvc
        .perform(get("/api/v1/schedule/{id}", "not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("INVALID_FORMAT"))
        .andExpect(jsonPath("$.parameter").value("id"));
  }

  @Test
  void updatePassesUserThrough() throws Exception {
    when(scheduleService.update(eq(ID), any(ScheduleRequest.class), eq("bob")))
        .thenReturn(schedule());

    mockMvc
        .perform(
            put("/api/v1/schedule/{id}", ID)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User", "bob")
                .content(
                    objectMapper.writeValueAsString(
                        new ScheduleRequest(2, "25 * * * *", null, "http://x/trigger", null, null))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.frequency").value(2));

    verify(scheduleService).update(eq(ID), any(ScheduleRequest.class), eq("bob"));
  }

  @Test
  void deleteReturnsNoContent() throws Exception {
    mockMvc.perform(delete("/api/v1/schedule/{id}", ID)).andExpect(status().isNoContent());

    verify(scheduleService).delete(ID);
  }

  @Test
  void failuresAreListed() throws Exception {
    ScheduleFailure failure = new ScheduleFailure(schedule(), 503, 3, "HTTP 503");
    failure.setFailureId(UUID.randomUUID());
    failure.setInitiatedAt(LocalDateTime.of(2024, 3, 1, 10, 25));
    when(scheduleService.listFailures(ID)).thenReturn(List.of(failure));

    mockMvc
        .perform(get("/api/v1/schedule/{id}/failures", ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].schedule_id").value(ID.toString()))
        .andExpect(jsonPath("$[0].status_code").value(503))
        .andExpect(jsonPath("$[0].attempts").value(3))
        .andExpect(jsonPath("$[0].failure_reason").value("HTTP 503"));
  }

  @Test
  void deliveringDisabledScheduleIsABadRequest() throws Exception {
    when(firingService.fireSchedule(ID))
        .thenThrow(new IllegalArgumentException("Schedule " + ID + " is disabled"));

    mockMvc
        .perform(post("/api/v1/schedule/{id}/deliver", ID))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("BUSINESS_RULE_VIOLATION"))
        .andExpect(jsonPath("$.message").value(containsString("disabled")));
  }

  private Schedule schedule() {
    CrontabTimer timer = new CrontabTimer();
    timer.setId(1L);
    timer.setMinute("25");
    timer.setHour("*");
    timer.setDayOfMonth("*");
    timer.setMonthOfYear("*");
    timer.setDayOfWeek("*");

    Schedule schedule = new Schedule();
    schedule.setScheduleId(ID);
    schedule.setFrequency(2);
    schedule.setCronDefinition("25 * * * *");
    schedule.setCrontabTimer(timer);
    schedule.setEndpoint("http://x/trigger");
    schedule.setPayload(objectMapper.createObjectNode().put("run", 1));
    schedule.setAuthToken("secret");
    schedule.setNextSendAt(LocalDateTime.of(2024, 3, 1, 10, 25));
    schedule.setCreatedAt(LocalDateTime.of(2024, 3, 1, 10, 20, 30));
    schedule.setUpdatedAt(LocalDateTime.of(2024, 3, 1, 10, 20, 30));
    return schedule;
  }
}
