package com.fourkites.webhook.scheduler.controller;

import com.fourkites.webhook.scheduler.dto.ScheduleFailureResponse;
import com.fourkites.webhook.scheduler.dto.ScheduleRequest;
import com.fourkites.webhook.scheduler.dto.ScheduleResponse;
import com.fourkites.webhook.scheduler.model.Schedule;
import com.fourkites.webhook.scheduler.service.ScheduleFiringService;
import com.fourkites.webhook.scheduler.service.ScheduleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/schedule")
@Tag(name = "Schedules", description = "Webhook schedule definitions")
@RequiredArgsConstructor
public class ScheduleController {

  static final String USER_HEADER = "X-User";

  private final ScheduleService scheduleService;
  private final ScheduleFiringService firingService;

  @PostMapping
  @Operation(
      summary = "Create a schedule",
      description = "Exactly one of cron_definition and interval_definition must be set")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "201", description = "Schedule created"),
        @ApiResponse(responseCode = "400", description = "Invalid timer definition or body")
      })
  public ResponseEntity<ScheduleResponse> createSchedule(
      @Valid @RequestBody ScheduleRequest request,
      @RequestHeader(value = USER_HEADER, required = false) String user) {
    Schedule schedule = scheduleService.create(request, user);
    return ResponseEntity.created(URI.create("/api/v1/schedule/" + schedule.getScheduleId()))
        .body(ScheduleResponse.from(schedule));
  }

  @GetMapping
  public ResponseEntity<Page<ScheduleResponse>> listSchedules(
      @RequestParam(defaultValue = "0") int page, @RequestParam(defaultValue = "20") int size) {
    PageRequest pageRequest =
        PageRequest.of(page, Math.min(Math.max(size, 1), 200), Sort.by(Sort.Direction.ASC, "createdAt"));
    return ResponseEntity.ok(scheduleService.list(pageRequest).map(ScheduleResponse::from));
  }

  @GetMapping("/{id}")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Schedule found"),
        @ApiResponse(responseCode = "404", description = "Schedule not found")
      })
  public ResponseEntity<ScheduleResponse> getSchedule(
      @Parameter(description = "Schedule ID", required = true) @PathVariable UUID id) {
    return ResponseEntity.ok(ScheduleResponse.from(scheduleService.findById(id)));
  }

  @PutMapping("/{id}")
  @Operation(summary = "Replace a schedule", description = "Counters and the enabled flag are kept")
  public ResponseEntity<ScheduleResponse> updateSchedule(
      @PathVariable UUID id,
      @Valid @RequestBody ScheduleRequest request,
      @RequestHeader(value = USER_HEADER, required = false) String user) {
    return ResponseEntity.ok(ScheduleResponse.from(scheduleService.update(id, request, user)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteSchedule(@PathVariable UUID id) {
    scheduleService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}/failures")
  @Operation(summary = "List failed deliveries", description = "Newest first")
  public ResponseEntity<List<ScheduleFailureResponse>> listFailures(@PathVariable UUID id) {
    return ResponseEntity.ok(
        scheduleService.listFailures(id).stream().map(ScheduleFailureResponse::from).toList());
  }

  @PostMapping("/{id}/deliver")
  @Operation(
      summary = "Deliver a schedule now",
      description = "Runs one delivery outside of any tick; counts toward frequency on success")
  public ResponseEntity<ScheduleFiringService.ScheduleOutcome> deliverNow(@PathVariable UUID id) {
    return ResponseEntity.ok(firingService.fireSchedule(id));
  }
}
