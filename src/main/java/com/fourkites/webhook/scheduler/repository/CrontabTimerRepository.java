package com.fourkites.webhook.scheduler.repository;

import com.fourkites.webhook.scheduler.model.CrontabTimer;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CrontabTimerRepository extends JpaRepository<CrontabTimer, Long> {

  Optional<CrontabTimer> findFirstByMinuteAndHourAndDayOfWeekAndDayOfMonthAndMonthOfYear(
      String minute, String hour, String dayOfWeek, String dayOfMonth, String monthOfYear);
}
