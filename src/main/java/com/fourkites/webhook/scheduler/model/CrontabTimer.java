package com.fourkites.webhook.scheduler.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "crontab_timers")
@Getter
@Setter
@NoArgsConstructor
public class CrontabTimer {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  private Long id;

  @Column(name = "minute", nullable = false, length = 240)
  private String minute;

  @Column(name = "hour", nullable = false, length = 96)
  private String hour;

  @Column(name = "day_of_week", nullable = false, length = 64)
  private String dayOfWeek;

  @Column(name = "day_of_month", nullable = false, length = 124)
  private String dayOfMonth;

  @Column(name = "month_of_year", nullable = false, length = 64)
  private String monthOfYear;

  /** Five-field expression in {@code minute hour day-of-month month day-of-week} order. */
  public String toExpression() {
    return minute + " " + hour + " " + dayOfMonth + " " + monthOfYear + " " + dayOfWeek;
  }
}
