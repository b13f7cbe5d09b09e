package com.fourkites.webhook.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fourkites.webhook.scheduler.dispatcher.DeliveryResult;
import com.fourkites.webhook.scheduler.dto.ScheduleRequest;
import com.fourkites.webhook.scheduler.model.CrontabTimer;
import com.fourkites.webhook.scheduler.model.IntervalTimer;
import com.fourkites.webhook.scheduler.model.Schedule;
import com.fourkites.webhook.scheduler.model.ScheduleFailure;
import com.fourkites.webhook.scheduler.repository.CrontabTimerRepository;
import com.fourkites.webhook.scheduler.repository.IntervalTimerRepository;
import com.fourkites.webhook.scheduler.repository.ScheduleFailureRepository;
import com.fourkites.webhook.scheduler.repository.ScheduleRepository;
import com.fourkites.webhook.scheduler.validation.ScheduleNotFoundException;
import com.fourkites.webhook.scheduler.validation.ScheduleValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScheduleServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-03-01T10:20:30Z"), ZoneOffset.UTC);
  private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

  @Mock private ScheduleRepository scheduleRepository;
  @Mock private CrontabTimerRepository crontabTimerRepository;
  @Mock private IntervalTimerRepository intervalTimerRepository;
  @Mock private ScheduleFailureRepository failureRepository;
  @Mock private ApplicationEventPublisher eventPublisher;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private ScheduleService service;

  @BeforeEach
  void setUp() {
    service =
        new ScheduleService(
            scheduleRepository,
            crontabTimerRepository,
            intervalTimerRepository,
            failureRepository,
            eventPublisher,
            objectMapper,
            CLOCK);

    when(scheduleRepository.saveAndFlush(any(Schedule.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    when(crontabTimerRepository.findFirstByMinuteAndHourAndDayOfWeekAndDayOfMonthAndMonthOfYear(
            anyString(), anyString(), anyString(), anyString(), anyString()))
        .thenReturn(Optional.empty());
    when(crontabTimerRepository.save(any(CrontabTimer.class)))
        .thenAnswer(
            invocation -> {
              CrontabTimer timer = invocation.getArgument(0);
              timer.setId(1L);
              return timer;
            });
    when(intervalTimerRepository.findFirstByEveryAndPeriod(anyInt(), anyString()))
        .thenReturn(Optional.empty());
    when(intervalTimerRepository.save(any(IntervalTimer.class)))
        .thenAnswer(
            invocation -> {
              IntervalTimer timer = invocation.getArgument(0);
              timer.setId(9L);
              return timer;
            });
  }

  @Test
  void createBindsNewCrontabTimerAndPublishesEvent() throws Exception {
    ScheduleRequest req =
        new ScheduleRequest(
            2, "25 * * * *", null, "http://x/trigger", objectMapper.readTree("{\"run\":1}"), "tok");

    Schedule created = service.create(req, "alice");

    ArgumentCaptor<CrontabTimer> timer = ArgumentCaptor.forClass(CrontabTimer.class);
    verify(crontabTimerRepository).save(timer.capture());
    assertThat(timer.getValue().getMinute()).isEqualTo("25");
    assertThat(timer.getValue().getHour()).isEqualTo("*");

    assertThat(created.getScheduleId()).isNotNull();
    assertThat(created.getCrontabTimer().getId()).isEqualTo(1L);
    assertThat(created.getIntervalTimer()).isNull();
    assertThat(created.getTriggered()).isZero();
    assertThat(created.isEnabled()).isTrue();
    assertThat(created.getAuthToken()).isEqualTo("tok");
    assertThat(created.getCreatedBy()).isEqualTo("alice");
    assertThat(created.getNextSendAt()).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 25));

    ArgumentCaptor<ScheduleCreatedEvent> event = ArgumentCaptor.forClass(ScheduleCreatedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().schedule().id()).isEqualTo(created.getScheduleId());
    assertThat(event.getValue().schedule().cronDefinition()).isEqualTo("25 * * * *");
  }

  @Test
  void createReusesIdenticalCrontabTimer() {
    CrontabTimer existing = crontabTimer(7L, "25");
    when(crontabTimerRepository.findFirstByMinuteAndHourAndDayOfWeekAndDayOfMonthAndMonthOfYear(
            "25", "*", "*", "*", "*"))
        .thenReturn(Optional.of(existing));

    Schedule created = service.create(cronRequest("25 * * * *"), null);

    assertThat(created.getCrontabTimer()).isSameAs(existing);
    verify(crontabTimerRepository, never()).save(any());
  }

  @Test
  void createRejectsInvalidCronUnderFieldKey() {
    ScheduleValidationException e =
        catchThrowableOfType(
            () -> service.create(cronRequest("99 * * * *"), null),
            ScheduleValidationException.class);

    assertThat(e.getErrors())
        .isEqualTo(
            Map.of(
                "cron_definition",
                List.of(
                    "99 * * * * is not a valid crontab string: item value 99 out of range [0, 59]")));
    verify(scheduleRepository, never()).saveAndFlush(any());
    verify(eventPublisher, never()).publishEvent(any());
  }

  @Test
  void createRejectsInvalidIntervalUnderFieldKey() {
    ScheduleValidationException e =
        catchThrowableOfType(
            () -> service.create(intervalRequest("1 fortnights"), null),
            ScheduleValidationException.class);

    assertThat(e.getErrors()).containsOnlyKeys("interval_definition");
    assertThat(e.getErrors().get("interval_definition").get(0))
        .startsWith("1 fortnights is not a valid period.");
  }

  @Test
  void createRequiresExactlyOneDefinition() {
    ScheduleRequest both = new ScheduleRequest(1, "* * * * *", "1 minutes", "http://x", null, null);
    ScheduleRequest neither = new ScheduleRequest(1, null, "  ", "http://x", null, null);

    assertThat(catchThrowableOfType(() -> service.create(both, null), ScheduleValidationException.class).getErrors())
        .containsOnlyKeys("non_field_errors");
    assertThat(catchThrowableOfType(() -> service.create(neither, null), ScheduleValidationException.class).getErrors())
        .containsOnlyKeys("non_field_errors");
  }

  @Test
  void createIntervalScheduleDefaultsPayloadToEmptyObject() {
    Schedule created = service.create(intervalRequest("1 minutes"), null);

    assertThat(created.getIntervalTimer().getId()).isEqualTo(9L);
    assertThat(created.getIntervalTimer().getEvery()).isEqualTo(1);
    assertThat(created.getIntervalTimer().getPeriod()).isEqualTo("minutes");
    assertThat(created.getPayload().isObject()).isTrue();
    assertThat(created.getPayload().size()).isZero();
    assertThat(created.getNextSendAt()).isEqualTo(NOW.plusMinutes(1));
  }

  @Test
  void nonPositiveIntervalHasNoNextSendAt() {
    Schedule created = service.create(intervalRequest("0 seconds"), null);

    assertThat(created.getIntervalTimer()).isNotNull();
    assertThat(created.getNextSendAt()).isNull();
  }

  @Test
  void updateSwapsCronForIntervalAndDeletesOrphanedTimer() {
    CrontabTimer oldTimer = crontabTimer(3L, "25");
    Schedule existing = cronSchedule(oldTimer, 5, 2);
    when(scheduleRepository.findById(existing.getScheduleId())).thenReturn(Optional.of(existing));
    when(scheduleRepository.countByCrontabTimer_Id(3L)).thenReturn(0L);

    Schedule updated = service.update(existing.getScheduleId(), intervalRequest("5 minutes"), "bob");

    assertThat(updated.getCronDefinition()).isNull();
    assertThat(updated.getCrontabTimer()).isNull();
    assertThat(updated.getIntervalDefinition()).isEqualTo("5 minutes");
    assertThat(updated.getIntervalTimer().getId()).isEqualTo(9L);
    assertThat(updated.getUpdatedBy()).isEqualTo("bob");
    assertThat(updated.getTriggered()).isEqualTo(2);
    verify(crontabTimerRepository).delete(oldTimer);
  }

  @Test
  void updateKeepsTimerStillUsedByAnotherSchedule() {
    CrontabTimer shared = crontabTimer(3L, "25");
    Schedule existing = cronSchedule(shared, 5, 0);
    when(scheduleRepository.findById(existing.getScheduleId())).thenReturn(Optional.of(existing));
    when(scheduleRepository.countByCrontabTimer_Id(3L)).thenReturn(1L);

    service.update(existing.getScheduleId(), cronRequest("0 * * * *"), null);

    verify(crontabTimerRepository, never()).delete(any());
  }

  @Test
  void updateWithUnchangedCronKeepsTimerAndCounters() {
    CrontabTimer timer = crontabTimer(3L, "25");
    Schedule existing = cronSchedule(timer, 5, 4);
    existing.setEnabled(false);
    when(scheduleRepository.findById(existing.getScheduleId())).thenReturn(Optional.of(existing));

    Schedule updated =
        service.update(
            existing.getScheduleId(),
            new ScheduleRequest(5, "25 * * * *", null, "http://y/hook", null, null),
            null);

    assertThat(updated.getCrontabTimer()).isSameAs(timer);
    assertThat(updated.getEndpoint()).isEqualTo("http://y/hook");
    assertThat(updated.getTriggered()).isEqualTo(4);
    assertThat(updated.isEnabled()).isFalse();
    verify(crontabTimerRepository, never()).save(any());
    verify(crontabTimerRepository, never()).delete(any());
  }

  @Test
  void updateOfUnknownScheduleIsNotFound() {
    UUID id = UUID.randomUUID();
    when(scheduleRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.update(id, cronRequest("* * * * *"), null))
        .isInstanceOf(ScheduleNotFoundException.class);
  }

  @Test
  void deleteRemovesFailuresScheduleAndOrphanedTimer() {
    CrontabTimer timer = crontabTimer(3L, "25");
    Schedule existing = cronSchedule(timer, 1, 0);
    UUID id = existing.getScheduleId();
    when(scheduleRepository.findById(id)).thenReturn(Optional.of(existing));
    when(scheduleRepository.countByCrontabTimer_Id(3L)).thenReturn(0L);

    service.delete(id);

    verify(failureRepository).deleteByScheduleId(id);
    verify(scheduleRepository).delete(existing);
    verify(crontabTimerRepository).delete(timer);
  }

  @Test
  void successfulFiringIncrementsAndKeepsEnabledBelowFrequency() {
    Schedule schedule = cronSchedule(crontabTimer(1L, "25"), 2, 0);
    when(scheduleRepository.findById(schedule.getScheduleId())).thenReturn(Optional.of(schedule));

    Schedule updated = service.recordSuccessfulFiring(schedule.getScheduleId());

    assertThat(updated.getTriggered()).isEqualTo(1);
    assertThat(updated.isEnabled()).isTrue();
    assertThat(updated.getNextSendAt()).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 25));
    verify(scheduleRepository).saveAndFlush(schedule);
  }

  @Test
  void successfulFiringThatReachesFrequencyDisablesInSameWrite() {
    Schedule schedule = cronSchedule(crontabTimer(1L, "25"), 2, 1);
    when(scheduleRepository.findById(schedule.getScheduleId())).thenReturn(Optional.of(schedule));

    Schedule updated = service.recordSuccessfulFiring(schedule.getScheduleId());

    assertThat(updated.getTriggered()).isEqualTo(2);
    assertThat(updated.isEnabled()).isFalse();
    assertThat(updated.getNextSendAt()).isNull();
    verify(scheduleRepository).saveAndFlush(schedule);
  }

  @Test
  void zeroFrequencyNeverDisables() {
    Schedule schedule = cronSchedule(crontabTimer(1L, "25"), 0, 41);
    when(scheduleRepository.findById(schedule.getScheduleId())).thenReturn(Optional.of(schedule));

    Schedule updated = service.recordSuccessfulFiring(schedule.getScheduleId());

    assertThat(updated.getTriggered()).isEqualTo(42);
    assertThat(updated.isEnabled()).isTrue();
  }

  @Test
  void firingOnDisabledScheduleDoesNotIncrement() {
    Schedule schedule = cronSchedule(crontabTimer(1L, "25"), 2, 2);
    schedule.setEnabled(false);
    when(scheduleRepository.findById(schedule.getScheduleId())).thenReturn(Optional.of(schedule));

    Schedule updated = service.recordSuccessfulFiring(schedule.getScheduleId());

    assertThat(updated.getTriggered()).isEqualTo(2);
    verify(scheduleRepository, never()).saveAndFlush(any());
  }

  @Test
  void firingOnMissingScheduleIsNotFound() {
    UUID id = UUID.randomUUID();
    when(scheduleRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.recordSuccessfulFiring(id))
        .isInstanceOf(ScheduleNotFoundException.class);
  }

  @Test
  void failedDeliveryIsRecordedWithoutTouchingCounters() {
    Schedule schedule = cronSchedule(crontabTimer(1L, "25"), 2, 1);
    when(scheduleRepository.findById(schedule.getScheduleId())).thenReturn(Optional.of(schedule));
    when(failureRepository.save(any(ScheduleFailure.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    ScheduleFailure failure =
        service.recordFailedDelivery(
            schedule.getScheduleId(), DeliveryResult.failed(3, 503, "HTTP 503", true));

    assertThat(failure.getScheduleId()).isEqualTo(schedule.getScheduleId());
    assertThat(failure.getEndpoint()).isEqualTo("http://x/trigger");
    assertThat(failure.getStatusCode()).isEqualTo(503);
    assertThat(failure.getAttempts()).isEqualTo(3);
    assertThat(failure.getFailureReason()).isEqualTo("HTTP 503");
    assertThat(schedule.getTriggered()).isEqualTo(1);
    assertThat(schedule.isEnabled()).isTrue();
    verify(scheduleRepository, never()).saveAndFlush(any());
  }

  @Test
  void listFailuresOfUnknownScheduleIsNotFound() {
    UUID id = UUID.randomUUID();
    when(scheduleRepository.existsById(id)).thenReturn(false);

    assertThatThrownBy(() -> service.listFailures(id)).isInstanceOf(ScheduleNotFoundException.class);
  }

  private static ScheduleRequest cronRequest(String cron) {
    return new ScheduleRequest(2, cron, null, "http://x/trigger", null, null);
  }

  private static ScheduleRequest intervalRequest(String interval) {
    return new ScheduleRequest(2, null, interval, "http://x/trigger", null, null);
  }

  private static CrontabTimer crontabTimer(Long id, String minute) {
    CrontabTimer timer = new CrontabTimer();
    timer.setId(id);
    timer.setMinute(minute);
    timer.setHour("*");
    timer.setDayOfWeek("*");
    timer.setDayOfMonth("*");
    timer.setMonthOfYear("*");
    return timer;
  }

  private Schedule cronSchedule(CrontabTimer timer, int frequency, int triggered) {
    Schedule schedule = new Schedule();
    schedule.setScheduleId(UUID.randomUUID());
    schedule.setCronDefinition(timer.toExpression());
    schedule.setCrontabTimer(timer);
    schedule.setFrequency(frequency);
    schedule.setTriggered(triggered);
    schedule.setEnabled(true);
    schedule.setEndpoint("http://x/trigger");
    schedule.setPayload(objectMapper.createObjectNode());
    return schedule;
  }
}
