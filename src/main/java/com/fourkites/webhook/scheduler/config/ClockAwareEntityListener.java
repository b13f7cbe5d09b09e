package com.fourkites.webhook.scheduler.config;

import com.fourkites.webhook.scheduler.model.Schedule;
import com.fourkites.webhook.scheduler.model.ScheduleFailure;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * JPA entity listener that stamps schedule and failure rows from the central UTC Clock bean.
 */
@Component
public class ClockAwareEntityListener {

  private static Clock clock;

  /** Static injection; JPA instantiates entity listeners itself. */
  @Autowired
  public void setClock(Clock clock) {
    ClockAwareEntityListener.clock = clock;
  }

  @PrePersist
  public void onPrePersist(Object entity) {
    LocalDateTime now = now();

    if (entity instanceof Schedule schedule) {
      if (schedule.getScheduleId() == null) {
        schedule.setScheduleId(UUID.randomUUID());
      }
      if (schedule.getCreatedAt() == null) {
        schedule.setCreatedAt(now);
      }
      schedule.setUpdatedAt(now);
    } else if (entity instanceof ScheduleFailure failure) {
      if (failure.getFailureId() == null) {
        failure.setFailureId(UUID.randomUUID());
      }
      if (failure.getInitiatedAt() == null) {
        failure.setInitiatedAt(now);
      }
    }
  }

  @PreUpdate
  public void onPreUpdate(Object entity) {
    if (entity instanceof Schedule schedule) {
      schedule.setUpdatedAt(now());
    }
  }

  private static LocalDateTime now() {
    return LocalDateTime.now(clock != null ? clock : Clock.systemUTC());
  }
}
