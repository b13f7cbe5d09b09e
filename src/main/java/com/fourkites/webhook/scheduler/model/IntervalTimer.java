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
@Table(name = "interval_timers")
@Getter
@Setter
@NoArgsConstructor
public class IntervalTimer {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  private Long id;

  @Column(name = "every", nullable = false)
  private int every;

  @Column(name = "period", nullable = false, length = 24)
  private String period; // days, hours, minutes, seconds, microseconds
}
