package com.fourkites.webhook.scheduler.repository;

import com.fourkites.webhook.scheduler.model.IntervalTimer;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IntervalTimerRepository extends JpaRepository<IntervalTimer, Long> {

  Optional<IntervalTimer> findFirstByEveryAndPeriod(int every, String period);
}
