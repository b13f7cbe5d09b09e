package com.fourkites.webhook.scheduler.timer;

/** A validated interval definition. {@code every} is not range checked. */
public record IntervalSpec(int every, IntervalPeriod period) {

  public String toDefinition() {
    return every + " " + period.value();
  }
}
