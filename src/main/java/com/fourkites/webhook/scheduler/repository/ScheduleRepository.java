package com.fourkites.webhook.scheduler.repository;

import com.fourkites.webhook.scheduler.model.Schedule;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

  /** Enabled schedules bound to a crontab timer; the tick selection query. */
  List<Schedule> findByCrontabTimer_IdAndEnabledTrue(Long crontabTimerId);

  /** Enabled schedules bound to an interval timer; the tick selection query. */
  List<Schedule> findByIntervalTimer_IdAndEnabledTrue(Long intervalTimerId);

  // Reference counts used before a timer is deleted
  long countByCrontabTimer_Id(Long crontabTimerId);

  long countByIntervalTimer_Id(Long intervalTimerId);
}
