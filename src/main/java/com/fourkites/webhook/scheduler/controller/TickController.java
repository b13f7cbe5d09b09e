package com.fourkites.webhook.scheduler.controller;

import com.fourkites.webhook.scheduler.dto.ScheduleResponse;
import com.fourkites.webhook.scheduler.model.ScheduleKind;
import com.fourkites.webhook.scheduler.service.DueScheduleSelector;
import com.fourkites.webhook.scheduler.service.ScheduleFiringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Manual form of the tick trigger, plus the read side used when recovering missed ticks. */
@RestController
@RequestMapping("/api/v1/ticks/{scheduleType}/{lookupId}")
@Tag(name = "Ticks", description = "Timer ticks and due-schedule inspection")
@RequiredArgsConstructor
public class TickController {

  private final ScheduleFiringService firingService;
  private final DueScheduleSelector selector;

  @PostMapping
  @Operation(summary = "Fire a timer", description = "Delivers every enabled schedule bound to the timer")
  public ResponseEntity<ScheduleFiringService.FiringReport> runTick(
      @PathVariable String scheduleType, @PathVariable long lookupId) {
    return ResponseEntity.ok(firingService.runTick(ScheduleKind.fromValue(scheduleType), lookupId));
  }

  @GetMapping("/schedules")
  @Operation(summary = "List due schedules", description = "Enabled schedules bound to the timer")
  public ResponseEntity<List<ScheduleResponse>> dueSchedules(
      @PathVariable String scheduleType, @PathVariable long lookupId) {
    return ResponseEntity.ok(
        selector.findDue(ScheduleKind.fromValue(scheduleType), lookupId).stream()
            .map(ScheduleResponse::from)
            .toList());
  }
}
