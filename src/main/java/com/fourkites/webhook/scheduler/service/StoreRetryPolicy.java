package com.fourkites.webhook.scheduler.service;

import com.fourkites.webhook.scheduler.config.AppProperties;
import java.sql.SQLException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

/**
 * Retries single-row store writes that lost an optimistic-lock race or hit a transient database
 * error. Each retry runs the whole write again in a fresh transaction.
 */
@Component
public class StoreRetryPolicy {

  private static final Logger log = LoggerFactory.getLogger(StoreRetryPolicy.class);

  private final int maxRetries;
  private final long retryBaseDelayMs;

  @Autowired
  public StoreRetryPolicy(AppProperties appProps) {
    var db = appProps.db();
    this.maxRetries = db != null && db.maxRetries() != null ? db.maxRetries() : 3;
    this.retryBaseDelayMs = db != null && db.retryBaseDelayMs() != null ? db.retryBaseDelayMs() : 50L;
  }

  public StoreRetryPolicy(int maxRetries, long retryBaseDelayMs) {
    this.maxRetries = maxRetries;
    this.retryBaseDelayMs = retryBaseDelayMs;
  }

  /**
   * Runs {@code write}, retrying retryable failures up to the configured budget.
   *
   * @throws RuntimeException the last failure when it is not retryable or retries ran out
   */
  public <T> T execute(String description, Supplier<T> write) {
    int attempt = 1;
    while (true) {
      try {
        return write.get();
      } catch (RuntimeException e) {
        if (attempt > maxRetries || !isRetryableError(e)) {
          throw e;
        }
        Duration delay = calculateRetryDelay(attempt);
        log.debug(
            "Retrying {} in {} ms after attempt {}: {}",
            description,
            delay.toMillis(),
            attempt,
            e.getMessage());
        if (!delay.isZero()) {
          try {
            Thread.sleep(delay.toMillis());
          } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw e;
          }
        }
        attempt++;
      }
    }
  }

  /** Optimistic-lock conflicts, deadlocks, serialization failures and dropped connections. */
  public boolean isRetryableError(Throwable error) {
    Throwable cause = error;
    while (cause != null) {
      if (cause instanceof TransientDataAccessException) {
        return true;
      }
      if (cause instanceof SQLException sqlEx && isRetryableSqlState(sqlEx.getSQLState())) {
        return true;
      }
      cause = cause.getCause();
    }
    return false;
  }

  private boolean isRetryableSqlState(String sqlState) {
    if (sqlState == null) {
      return false;
    }
    return sqlState.startsWith("08") // connection exception
        || "40001".equals(sqlState) // serialization failure
        || "40P01".equals(sqlState) // deadlock detected
        || "55P03".equals(sqlState); // lock not available
  }

  /** Exponential backoff, capped at two seconds since a tick is waiting on these writes. */
  public Duration calculateRetryDelay(int attemptNumber) {
    long delayMs = retryBaseDelayMs * (1L << Math.min(attemptNumber - 1, 20));
    return Duration.ofMillis(Math.min(delayMs, 2000));
  }

  public int getMaxRetries() {
    return maxRetries;
  }
}
