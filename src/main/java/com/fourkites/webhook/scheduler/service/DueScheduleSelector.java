package com.fourkites.webhook.scheduler.service;

import com.fourkites.webhook.scheduler.model.Schedule;
import com.fourkites.webhook.scheduler.model.ScheduleKind;
import com.fourkites.webhook.scheduler.repository.ScheduleRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Finds the enabled schedules bound to the timer that just fired. */
@Service
public class DueScheduleSelector {

  private final ScheduleRepository scheduleRepository;

  public DueScheduleSelector(ScheduleRepository scheduleRepository) {
    this.scheduleRepository = scheduleRepository;
  }

  /** Snapshot read; schedules disabled after this call are filtered again at write time. */
  @Transactional(readOnly = true)
  public List<Schedule> findDue(ScheduleKind kind, long timerId) {
    return switch (kind) {
      case CRONTAB -> scheduleRepository.findByCrontabTimer_IdAndEnabledTrue(timerId);
      case INTERVAL -> scheduleRepository.findByIntervalTimer_IdAndEnabledTrue(timerId);
    };
  }
}
