package com.fourkites.webhook.scheduler.model;

import com.fourkites.webhook.scheduler.config.ClockAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One delivery that failed after the dispatcher gave up retrying. */
@Entity
@Table(name = "schedule_failures")
@EntityListeners(ClockAwareEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class ScheduleFailure {

  @Id
  @Column(name = "failure_id", columnDefinition = "uuid")
  private UUID failureId;

  @Column(name = "schedule_id", nullable = false, columnDefinition = "uuid")
  private UUID scheduleId;

  @Column(name = "endpoint", nullable = false, length = 500)
  private String endpoint;

  @Column(name = "status_code")
  private Integer statusCode;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "failure_reason", nullable = false)
  private String failureReason;

  @Column(name = "initiated_at", nullable = false)
  private LocalDateTime initiatedAt;

  public ScheduleFailure(Schedule schedule, Integer statusCode, int attempts, String reason) {
    this.scheduleId = schedule.getScheduleId();
    this.endpoint = schedule.getEndpoint();
    this.statusCode = statusCode;
    this.attempts = attempts;
    this.failureReason = reason;
  }
}
