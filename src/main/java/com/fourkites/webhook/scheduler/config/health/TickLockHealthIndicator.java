package com.fourkites.webhook.scheduler.config.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/** Reports whether the Redis backend of the per-timer tick lock answers a PING. */
@Component
public class TickLockHealthIndicator implements HealthIndicator {
  private final RedisConnectionFactory connectionFactory;

  public TickLockHealthIndicator(RedisConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
  }

  @Override
  public Health health() {
    try (var conn = connectionFactory.getConnection()) {
      String pong = conn.ping();
      if (pong != null && !pong.isBlank()) {
        return Health.up().withDetail("tickLock", "redis reachable").build();
      }
      // ticks still run without the lock, so this is degraded rather than down
      return Health.unknown().withDetail("tickLock", "no pong, ticks run unlocked").build();
    } catch (Exception e) {
      return Health.unknown()
          .withDetail("tickLock", "redis unreachable, ticks run unlocked")
          .withException(e)
          .build();
    }
  }
}
