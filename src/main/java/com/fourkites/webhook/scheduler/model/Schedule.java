package com.fourkites.webhook.scheduler.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fourkites.webhook.scheduler.config.ClockAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;

@Entity
@Table(name = "schedules")
@EntityListeners(ClockAwareEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class Schedule {

  @Version
  @Column(name = "version")
  private Long version;

  @Id
  @Column(name = "schedule_id", columnDefinition = "uuid")
  private UUID scheduleId;

  @Column(name = "frequency", nullable = false)
  private int frequency;

  @Column(name = "cron_definition", length = 200)
  private String cronDefinition;

  @ManyToOne(fetch = FetchType.EAGER)
  @JoinColumn(name = "crontab_timer_id")
  private CrontabTimer crontabTimer;

  @Column(name = "interval_definition", length = 200)
  private String intervalDefinition;

  @ManyToOne(fetch = FetchType.EAGER)
  @JoinColumn(name = "interval_timer_id")
  private IntervalTimer intervalTimer;

  @Column(name = "endpoint", nullable = false, length = 500)
  private String endpoint;

  @JdbcTypeCode(org.hibernate.type.SqlTypes.JSON)
  @Column(name = "payload", nullable = false)
  private JsonNode payload;

  @Column(name = "auth_token", length = 500)
  private String authToken;

  @Column(name = "next_send_at")
  private LocalDateTime nextSendAt;

  @Column(name = "triggered", nullable = false)
  private int triggered = 0;

  @Column(name = "enabled", nullable = false)
  private boolean enabled = true;

  @Column(name = "created_at", nullable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at", nullable = false)
  private LocalDateTime updatedAt;

  @Column(name = "created_by")
  private String createdBy;

  @Column(name = "updated_by")
  private String updatedBy;

  public ScheduleKind getKind() {
    return cronDefinition != null ? ScheduleKind.CRONTAB : ScheduleKind.INTERVAL;
  }

  /** True once a bounded schedule has used up its firings. */
  public boolean isExhausted() {
    return frequency > 0 && triggered >= frequency;
  }
}
