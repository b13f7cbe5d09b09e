package com.fourkites.webhook.scheduler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fourkites.webhook.scheduler.dispatcher.DeliveryResult;
import com.fourkites.webhook.scheduler.dto.ScheduleRequest;
import com.fourkites.webhook.scheduler.dto.ScheduleResponse;
import com.fourkites.webhook.scheduler.model.CrontabTimer;
import com.fourkites.webhook.scheduler.model.IntervalTimer;
import com.fourkites.webhook.scheduler.model.Schedule;
import com.fourkites.webhook.scheduler.model.ScheduleFailure;
import com.fourkites.webhook.scheduler.repository.CrontabTimerRepository;
import com.fourkites.webhook.scheduler.repository.IntervalTimerRepository;
import com.fourkites.webhook.scheduler.repository.ScheduleFailureRepository;
import com.fourkites.webhook.scheduler.repository.ScheduleRepository;
import com.fourkites.webhook.scheduler.timer.CrontabSpec;
import com.fourkites.webhook.scheduler.timer.IntervalSpec;
import com.fourkites.webhook.scheduler.timer.TimerSpecException;
import com.fourkites.webhook.scheduler.timer.TimerSpecParser;
import com.fourkites.webhook.scheduler.util.TimeUtils;
import com.fourkites.webhook.scheduler.validation.ScheduleNotFoundException;
import com.fourkites.webhook.scheduler.validation.ScheduleValidationException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns schedule rows and the timer rows they are bound to. Schedules that share an identical
 * timer definition share one timer row; a timer row is deleted as soon as no schedule references
 * it.
 */
@Service
@Slf4j
public class ScheduleService {

  static final String CRON_FIELD = "cron_definition";
  static final String INTERVAL_FIELD = "interval_definition";

  private final ScheduleRepository scheduleRepository;
  private final CrontabTimerRepository crontabTimerRepository;
  private final IntervalTimerRepository intervalTimerRepository;
  private final ScheduleFailureRepository failureRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ScheduleService(
      ScheduleRepository scheduleRepository,
      CrontabTimerRepository crontabTimerRepository,
      IntervalTimerRepository intervalTimerRepository,
      ScheduleFailureRepository failureRepository,
      ApplicationEventPublisher eventPublisher,
      ObjectMapper objectMapper,
      Clock clock) {
    this.scheduleRepository = scheduleRepository;
    this.crontabTimerRepository = crontabTimerRepository;
    this.intervalTimerRepository = intervalTimerRepository;
    this.failureRepository = failureRepository;
    this.eventPublisher = eventPublisher;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Transactional
  public Schedule create(ScheduleRequest req, String user) {
    Schedule schedule = new Schedule();
    schedule.setScheduleId(UUID.randomUUID());
    schedule.setTriggered(0);
    schedule.setEnabled(true);
    schedule.setCreatedBy(user);
    schedule.setUpdatedBy(user);

    Schedule saved = apply(schedule, req);
    log.info(
        "Created schedule {} on {} timer {} (frequency={}, next_send_at={})",
        saved.getScheduleId(),
        saved.getKind().value(),
        timerId(saved),
        saved.getFrequency(),
        saved.getNextSendAt());

    eventPublisher.publishEvent(new ScheduleCreatedEvent(ScheduleResponse.from(saved)));
    return saved;
  }

  /** Full replacement of the editable fields; counters and the enabled flag are kept. */
  @Transactional
  public Schedule update(UUID scheduleId, ScheduleRequest req, String user) {
    Schedule schedule = findById(scheduleId);
    schedule.setUpdatedBy(user);
    Schedule saved = apply(schedule, req);
    log.info("Updated schedule {} (next_send_at={})", scheduleId, saved.getNextSendAt());
    return saved;
  }

  @Transactional
  public void delete(UUID scheduleId) {
    Schedule schedule = findById(scheduleId);
    CrontabTimer crontabTimer = schedule.getCrontabTimer();
    IntervalTimer intervalTimer = schedule.getIntervalTimer();

    int failures = failureRepository.deleteByScheduleId(scheduleId);
    scheduleRepository.delete(schedule);
    scheduleRepository.flush();

    releaseCrontabTimer(crontabTimer, null);
    releaseIntervalTimer(intervalTimer, null);
    log.info("Deleted schedule {} and {} failure record(s)", scheduleId, failures);
  }

  @Transactional(readOnly = true)
  public Schedule findById(UUID scheduleId) {
    return scheduleRepository
        .findById(scheduleId)
        .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
  }

  @Transactional(readOnly = true)
  public Page<Schedule> list(Pageable pageable) {
    return scheduleRepository.findAll(pageable);
  }

  @Transactional(readOnly = true)
  public List<ScheduleFailure> listFailures(UUID scheduleId) {
    if (!scheduleRepository.existsById(scheduleId)) {
      throw new ScheduleNotFoundException(scheduleId);
    }
    return failureRepository.findByScheduleIdOrderByInitiatedAtDesc(scheduleId);
  }

  /**
   * Counts one successful delivery. The read-modify-write is versioned, so a concurrent writer
   * makes this throw an optimistic-lock failure and the caller re-runs it on fresh state. A
   * schedule that is already disabled is left untouched, which keeps {@code triggered} from
   * passing {@code frequency} when overlapping ticks deliver the same schedule.
   */
  @Transactional
  public Schedule recordSuccessfulFiring(UUID scheduleId) {
    Schedule schedule = findById(scheduleId);
    if (!schedule.isEnabled()) {
      log.info(
          "Schedule {} was disabled before its delivery was recorded, triggered stays {}",
          scheduleId,
          schedule.getTriggered());
      return schedule;
    }

    schedule.setTriggered(schedule.getTriggered() + 1);
    if (schedule.isExhausted()) {
      schedule.setEnabled(false);
      log.info(
          "Schedule {} reached frequency {}, disabling", scheduleId, schedule.getFrequency());
    }
    schedule.setNextSendAt(schedule.isEnabled() ? computeNextSendAt(schedule) : null);
    return scheduleRepository.saveAndFlush(schedule);
  }

  @Transactional
  public ScheduleFailure recordFailedDelivery(UUID scheduleId, DeliveryResult result) {
    Schedule schedule = findById(scheduleId);
    ScheduleFailure failure =
        new ScheduleFailure(schedule, result.statusCode(), result.attempts(), result.reason());
    failure.setFailureId(UUID.randomUUID());
    return failureRepository.save(failure);
  }

  /** Validates the request, binds the matching timer row and saves the schedule. */
  private Schedule apply(Schedule schedule, ScheduleRequest req) {
    String cron = trimToNull(req.cronDefinition());
    String interval = trimToNull(req.intervalDefinition());
    if ((cron == null) == (interval == null)) {
      throw ScheduleValidationException.of(
          ScheduleValidationException.NON_FIELD_ERRORS,
          "Exactly one of cron_definition and interval_definition must be set");
    }

    // unchanged definitions keep their timer and are not re-validated
    boolean cronChanged =
        cron != null && (schedule.getCrontabTimer() == null || !cron.equals(schedule.getCronDefinition()));
    boolean intervalChanged =
        interval != null
            && (schedule.getIntervalTimer() == null || !interval.equals(schedule.getIntervalDefinition()));

    Map<String, List<String>> errors = new LinkedHashMap<>();
    CrontabSpec crontabSpec = null;
    IntervalSpec intervalSpec = null;
    if (cronChanged) {
      try {
        crontabSpec = TimerSpecParser.parseCrontab(cron);
      } catch (TimerSpecException e) {
        errors.put(CRON_FIELD, List.of(e.getMessage()));
      }
    }
    if (intervalChanged) {
      try {
        intervalSpec = TimerSpecParser.parseInterval(interval);
      } catch (TimerSpecException e) {
        errors.put(INTERVAL_FIELD, List.of(e.getMessage()));
      }
    }
    if (!errors.isEmpty()) {
      throw new ScheduleValidationException(errors);
    }

    CrontabTimer previousCrontab = schedule.getCrontabTimer();
    IntervalTimer previousInterval = schedule.getIntervalTimer();

    if (cron != null) {
      if (cronChanged) {
        schedule.setCrontabTimer(findOrCreateCrontabTimer(crontabSpec));
      }
      schedule.setCronDefinition(cron);
      schedule.setIntervalDefinition(null);
      schedule.setIntervalTimer(null);
    } else {
      if (intervalChanged) {
        schedule.setIntervalTimer(findOrCreateIntervalTimer(intervalSpec));
      }
      schedule.setIntervalDefinition(interval);
      schedule.setCronDefinition(null);
      schedule.setCrontabTimer(null);
    }

    schedule.setFrequency(req.frequency());
    schedule.setEndpoint(req.endpoint());
    schedule.setPayload(payloadOrEmpty(req.payload()));
    schedule.setAuthToken(trimToNull(req.authToken()));
    schedule.setNextSendAt(schedule.isEnabled() ? computeNextSendAt(schedule) : null);

    Schedule saved = scheduleRepository.saveAndFlush(schedule);

    releaseCrontabTimer(previousCrontab, saved.getCrontabTimer());
    releaseIntervalTimer(previousInterval, saved.getIntervalTimer());
    return saved;
  }

  private CrontabTimer findOrCreateCrontabTimer(CrontabSpec spec) {
    return crontabTimerRepository
        .findFirstByMinuteAndHourAndDayOfWeekAndDayOfMonthAndMonthOfYear(
            spec.minute(), spec.hour(), spec.dayOfWeek(), spec.dayOfMonth(), spec.monthOfYear())
        .orElseGet(
            () -> {
              CrontabTimer timer = new CrontabTimer();
              timer.setMinute(spec.minute());
              timer.setHour(spec.hour());
              timer.setDayOfWeek(spec.dayOfWeek());
              timer.setDayOfMonth(spec.dayOfMonth());
              timer.setMonthOfYear(spec.monthOfYear());
              CrontabTimer created = crontabTimerRepository.save(timer);
              log.info("Created crontab timer {} for '{}'", created.getId(), spec.toExpression());
              return created;
            });
  }

  private IntervalTimer findOrCreateIntervalTimer(IntervalSpec spec) {
    String period = spec.period().value();
    return intervalTimerRepository
        .findFirstByEveryAndPeriod(spec.every(), period)
        .orElseGet(
            () -> {
              IntervalTimer timer = new IntervalTimer();
              timer.setEvery(spec.every());
              timer.setPeriod(period);
              IntervalTimer created = intervalTimerRepository.save(timer);
              log.info("Created interval timer {} for '{}'", created.getId(), spec.toDefinition());
              return created;
            });
  }

  private void releaseCrontabTimer(CrontabTimer previous, CrontabTimer current) {
    if (previous == null || previous.getId() == null) {
      return;
    }
    if (current != null && Objects.equals(previous.getId(), current.getId())) {
      return;
    }
    if (scheduleRepository.countByCrontabTimer_Id(previous.getId()) == 0) {
      crontabTimerRepository.delete(previous);
      log.info("Deleted unreferenced crontab timer {}", previous.getId());
    }
  }

  private void releaseIntervalTimer(IntervalTimer previous, IntervalTimer current) {
    if (previous == null || previous.getId() == null) {
      return;
    }
    if (current != null && Objects.equals(previous.getId(), current.getId())) {
      return;
    }
    if (scheduleRepository.countByIntervalTimer_Id(previous.getId()) == 0) {
      intervalTimerRepository.delete(previous);
      log.info("Deleted unreferenced interval timer {}", previous.getId());
    }
  }

  /** Advisory only; ticks come from outside and are never driven by this value. */
  private LocalDateTime computeNextSendAt(Schedule schedule) {
    LocalDateTime now = LocalDateTime.now(clock);
    if (schedule.getCrontabTimer() != null) {
      return TimeUtils.nextCronTime(schedule.getCrontabTimer(), now);
    }
    return TimeUtils.nextIntervalTime(schedule.getIntervalTimer(), now);
  }

  private JsonNode payloadOrEmpty(JsonNode payload) {
    return payload == null || payload.isNull() ? objectMapper.createObjectNode() : payload;
  }

  private static Long timerId(Schedule schedule) {
    if (schedule.getCrontabTimer() != null) {
      return schedule.getCrontabTimer().getId();
    }
    return schedule.getIntervalTimer() != null ? schedule.getIntervalTimer().getId() : null;
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
