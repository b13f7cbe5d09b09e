package com.fourkites.webhook.scheduler.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fourkites.webhook.scheduler.config.AppProperties;
import com.fourkites.webhook.scheduler.dispatcher.DeliveryResult;
import com.fourkites.webhook.scheduler.dispatcher.WebhookDispatcher;
import com.fourkites.webhook.scheduler.model.Schedule;
import com.fourkites.webhook.scheduler.model.ScheduleKind;
import com.fourkites.webhook.scheduler.model.TimerRef;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one timer tick: selects the due schedules, delivers each on the delivery pool and records
 * every outcome as its own single-row write. A schedule's counter only moves after its own
 * delivery succeeded.
 */
@Service
public class ScheduleFiringService {

  private static final Logger log = LoggerFactory.getLogger(ScheduleFiringService.class);

  private final DueScheduleSelector selector;
  private final ScheduleService scheduleService;
  private final WebhookDispatcher dispatcher;
  private final TickLockService lockService;
  private final StoreRetryPolicy storeRetryPolicy;
  private final ExecutorService deliveryExecutor;
  private final long tickTimeoutSeconds;

  public ScheduleFiringService(
      DueScheduleSelector selector,
      ScheduleService scheduleService,
      WebhookDispatcher dispatcher,
      TickLockService lockService,
      StoreRetryPolicy storeRetryPolicy,
      @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
      AppProperties appProps) {
    this.selector = selector;
    this.scheduleService = scheduleService;
    this.dispatcher = dispatcher;
    this.lockService = lockService;
    this.storeRetryPolicy = storeRetryPolicy;
    this.deliveryExecutor = deliveryExecutor;
    var tick = appProps.tick();
    this.tickTimeoutSeconds =
        tick != null && tick.timeoutSeconds() != null ? tick.timeoutSeconds() : 120L;
  }

  public FiringReport runTick(ScheduleKind kind, long timerId) {
    TimerRef timer = new TimerRef(kind, timerId);
    TickLockService.TickLock lock = lockService.acquire(timer);
    if (!lock.isAcquired()) {
      return FiringReport.skipped(timer);
    }

    try {
      List<Schedule> due = selector.findDue(kind, timerId);
      log.info("Tick {}: {} due schedule(s)", timer, due.size());

      Map<UUID, CompletableFuture<ScheduleOutcome>> tasks = new LinkedHashMap<>();
      for (Schedule schedule : due) {
        tasks.put(
            schedule.getScheduleId(),
            CompletableFuture.supplyAsync(() -> fire(schedule), deliveryExecutor));
      }
      awaitAll(timer, tasks.values());

      List<ScheduleOutcome> outcomes = new ArrayList<>(tasks.size());
      tasks.forEach(
          (scheduleId, task) -> {
            if (!task.isDone()) {
              // still running; it records its own result when it finishes
              outcomes.add(ScheduleOutcome.timedOut(scheduleId));
            } else if (task.isCompletedExceptionally()) {
              Throwable cause = failureOf(task);
              log.error("Delivery task for schedule {} failed in tick {}", scheduleId, timer, cause);
              outcomes.add(ScheduleOutcome.error(scheduleId, cause));
            } else {
              outcomes.add(task.join());
            }
          });

      FiringReport report = new FiringReport(timer, due.size(), outcomes, false);
      log.info(
          "Tick {} finished: {} (delivered={}, failed={}, storeErrors={}, errors={}, timedOut={})",
          timer,
          report.getMessage(),
          report.count(ScheduleOutcome.Status.DELIVERED),
          report.count(ScheduleOutcome.Status.DELIVERY_FAILED),
          report.count(ScheduleOutcome.Status.STORE_ERROR),
          report.count(ScheduleOutcome.Status.ERROR),
          report.count(ScheduleOutcome.Status.TIMED_OUT));
      return report;

    } finally {
      lockService.release(lock);
    }
  }

  /** Delivers one schedule right away, outside of any tick. */
  public ScheduleOutcome fireSchedule(UUID scheduleId) {
    Schedule schedule = scheduleService.findById(scheduleId);
    if (!schedule.isEnabled()) {
      throw new IllegalArgumentException("Schedule " + scheduleId + " is disabled");
    }
    log.info("Replaying delivery for schedule {}", scheduleId);
    return fire(schedule);
  }

  private ScheduleOutcome fire(Schedule schedule) {
    UUID scheduleId = schedule.getScheduleId();
    DeliveryResult result =
        dispatcher.deliver(schedule.getEndpoint(), schedule.getPayload(), schedule.getAuthToken());

    if (result.success()) {
      try {
        Schedule updated =
            storeRetryPolicy.execute(
                "firing record for schedule " + scheduleId,
                () -> scheduleService.recordSuccessfulFiring(scheduleId));
        log.debug(
            "Delivered schedule {} (triggered={}, enabled={})",
            scheduleId,
            updated.getTriggered(),
            updated.isEnabled());
        return ScheduleOutcome.delivered(scheduleId, result, updated);
      } catch (RuntimeException e) {
        log.error("Delivered schedule {} but could not record the firing", scheduleId, e);
        return ScheduleOutcome.storeError(scheduleId, result, e.getMessage());
      }
    }

    log.warn(
        "Delivery to {} for schedule {} failed after {} attempt(s): {}",
        schedule.getEndpoint(),
        scheduleId,
        result.attempts(),
        result.reason());
    try {
      scheduleService.recordFailedDelivery(scheduleId, result);
    } catch (RuntimeException e) {
      log.error("Could not record failed delivery for schedule {}", scheduleId, e);
      return ScheduleOutcome.storeError(scheduleId, result, e.getMessage());
    }
    return ScheduleOutcome.deliveryFailed(scheduleId, result);
  }

  private static Throwable failureOf(CompletableFuture<ScheduleOutcome> task) {
    try {
      task.join();
      return null;
    } catch (CompletionException | CancellationException e) {
      return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }
  }

  private void awaitAll(TimerRef timer, Collection<CompletableFuture<ScheduleOutcome>> tasks) {
    if (tasks.isEmpty()) {
      return;
    }
    CompletableFuture<Void> all = CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
    try {
      all.get(tickTimeoutSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      log.warn("Tick {} hit its {}s budget with deliveries still running", timer, tickTimeoutSeconds);
    } catch (ExecutionException e) {
      // runTick reports each failed task with its schedule
      log.debug("Tick {} finished with failed delivery tasks", timer);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Tick {} interrupted while waiting for deliveries", timer);
    }
  }

  /** What happened to one schedule during a tick or replay. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ScheduleOutcome {

    public enum Status {
      DELIVERED,
      DELIVERY_FAILED,
      STORE_ERROR,
      ERROR,
      TIMED_OUT
    }

    private final UUID scheduleId;
    private final Status status;
    private final Integer attempts;
    private final Integer statusCode;
    private final String reason;
    private final Integer triggered;
    private final Boolean enabled;

    private ScheduleOutcome(
        UUID scheduleId,
        Status status,
        Integer attempts,
        Integer statusCode,
        String reason,
        Integer triggered,
        Boolean enabled) {
      this.scheduleId = scheduleId;
      this.status = status;
      this.attempts = attempts;
      this.statusCode = statusCode;
      this.reason = reason;
      this.triggered = triggered;
      this.enabled = enabled;
    }

    static ScheduleOutcome delivered(UUID scheduleId, DeliveryResult result, Schedule updated) {
      return new ScheduleOutcome(
          scheduleId,
          Status.DELIVERED,
          result.attempts(),
          result.statusCode(),
          null,
          updated.getTriggered(),
          updated.isEnabled());
    }

    static ScheduleOutcome deliveryFailed(UUID scheduleId, DeliveryResult result) {
      return new ScheduleOutcome(
          scheduleId,
          Status.DELIVERY_FAILED,
          result.attempts(),
          result.statusCode(),
          result.reason(),
          null,
          null);
    }

    static ScheduleOutcome storeError(UUID scheduleId, DeliveryResult result, String reason) {
      return new ScheduleOutcome(
          scheduleId, Status.STORE_ERROR, result.attempts(), result.statusCode(), reason, null, null);
    }

    /** The delivery task itself failed, outside the delivery and store error handling. */
    static ScheduleOutcome error(UUID scheduleId, Throwable cause) {
      String reason = cause == null ? "delivery task failed" : cause.toString();
      return new ScheduleOutcome(scheduleId, Status.ERROR, null, null, reason, null, null);
    }

    static ScheduleOutcome timedOut(UUID scheduleId) {
      return new ScheduleOutcome(
          scheduleId, Status.TIMED_OUT, null, null, "delivery still running", null, null);
    }

    @JsonProperty("schedule_id")
    public UUID getScheduleId() {
      return scheduleId;
    }

    public Status getStatus() {
      return status;
    }

    public Integer getAttempts() {
      return attempts;
    }

    @JsonProperty("status_code")
    public Integer getStatusCode() {
      return statusCode;
    }

    public String getReason() {
      return reason;
    }

    public Integer getTriggered() {
      return triggered;
    }

    public Boolean getEnabled() {
      return enabled;
    }
  }

  /** Summary of one tick. {@code queued} counts schedules a delivery was attempted for. */
  public static class FiringReport {
    private final TimerRef timer;
    private final int queued;
    private final List<ScheduleOutcome> outcomes;
    private final boolean skipped;

    public FiringReport(TimerRef timer, int queued, List<ScheduleOutcome> outcomes, boolean skipped) {
      this.timer = timer;
      this.queued = queued;
      this.outcomes = Collections.unmodifiableList(outcomes);
      this.skipped = skipped;
    }

    static FiringReport skipped(TimerRef timer) {
      return new FiringReport(timer, 0, List.of(), true);
    }

    @JsonProperty("schedule_type")
    public String getScheduleType() {
      return timer.kind().value();
    }

    @JsonProperty("lookup_id")
    public long getLookupId() {
      return timer.lookupId();
    }

    public int getQueued() {
      return queued;
    }

    public boolean isSkipped() {
      return skipped;
    }

    public List<ScheduleOutcome> getOutcomes() {
      return outcomes;
    }

    public String getMessage() {
      return "Queued " + queued + " Tasks";
    }

    public long count(ScheduleOutcome.Status status) {
      return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
  }
}
