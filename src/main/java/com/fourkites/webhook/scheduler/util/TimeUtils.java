package com.fourkites.webhook.scheduler.util;

import com.cronutils.model.time.ExecutionTime;
import com.fourkites.webhook.scheduler.model.CrontabTimer;
import com.fourkites.webhook.scheduler.model.IntervalTimer;
import com.fourkites.webhook.scheduler.timer.IntervalPeriod;
import com.fourkites.webhook.scheduler.timer.TimerSpecException;
import com.fourkites.webhook.scheduler.timer.TimerSpecParser;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

public final class TimeUtils {
  private TimeUtils() { }

  /**
   * Next minute matching the crontab timer strictly after {@code from}, in UTC, or {@code null}
   * when the stored expression is not valid or never matches. When both day-of-month and
   * day-of-week are restricted, either one matching is enough (UNIX cron).
   */
  public static LocalDateTime nextCronTime(CrontabTimer timer, LocalDateTime from) {
    if (timer == null || from == null) {
      return null;
    }
    try {
      ExecutionTime executionTime =
          ExecutionTime.forCron(TimerSpecParser.toCron(timer.toExpression()));
      return executionTime
          .nextExecution(from.atZone(ZoneOffset.UTC))
          .map(ZonedDateTime::toLocalDateTime)
          .orElse(null);
    } catch (TimerSpecException e) {
      return null;
    }
  }

  /** {@code from} plus one interval period, or {@code null} for a non-positive interval. */
  public static LocalDateTime nextIntervalTime(IntervalTimer timer, LocalDateTime from) {
    if (timer == null || from == null || timer.getEvery() <= 0) {
      return null;
    }
    IntervalPeriod period = IntervalPeriod.fromValue(timer.getPeriod());
    if (period == null) {
      return null;
    }
    return from.plus(timer.getEvery(), period.unit());
  }
}
