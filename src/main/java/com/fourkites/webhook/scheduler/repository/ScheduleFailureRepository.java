package com.fourkites.webhook.scheduler.repository;

import com.fourkites.webhook.scheduler.model.ScheduleFailure;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface ScheduleFailureRepository extends JpaRepository<ScheduleFailure, UUID> {

  /** Failures for one schedule, newest first. */
  List<ScheduleFailure> findByScheduleIdOrderByInitiatedAtDesc(UUID scheduleId);

  @Modifying
  @Query(
      value =
          """
        DELETE FROM schedule_failures
        WHERE schedule_id = :scheduleId
        """,
      nativeQuery = true)
  int deleteByScheduleId(UUID scheduleId);
}
