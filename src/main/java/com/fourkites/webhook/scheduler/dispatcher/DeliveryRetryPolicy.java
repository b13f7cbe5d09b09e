package com.fourkites.webhook.scheduler.dispatcher;

import com.fourkites.webhook.scheduler.config.AppProperties;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Attempt budget and exponential backoff for webhook deliveries. */
@Component
public class DeliveryRetryPolicy {

  private final int maxAttempts;
  private final long baseDelayMs;
  private final long maxDelayMs;

  @Autowired
  public DeliveryRetryPolicy(AppProperties appProps) {
    var delivery = appProps.delivery();
    this.maxAttempts = delivery != null && delivery.maxAttempts() != null ? delivery.maxAttempts() : 3;
    this.baseDelayMs = delivery != null && delivery.baseDelayMs() != null ? delivery.baseDelayMs() : 1000L;
    this.maxDelayMs = delivery != null && delivery.maxDelayMs() != null ? delivery.maxDelayMs() : 30000L;
  }

  public DeliveryRetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /** Delay before the attempt that follows {@code attemptNumber} (1-based). */
  public Duration delayAfter(int attemptNumber) {
    int shift = Math.min(Math.max(attemptNumber - 1, 0), 30);
    long delayMs = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
    return Duration.ofMillis(Math.max(delayMs, 0));
  }

  /** 408, 429 and 5xx are worth another attempt; every other non-2xx status is final. */
  public boolean isRetryableStatus(int statusCode) {
    return statusCode == 408 || statusCode == 429 || (statusCode >= 500 && statusCode <= 599);
  }
}
