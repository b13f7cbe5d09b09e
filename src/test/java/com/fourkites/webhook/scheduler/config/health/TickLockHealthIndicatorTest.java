package com.fourkites.webhook.scheduler.config.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

@ExtendWith(MockitoExtension.class)
class TickLockHealthIndicatorTest {

  @Mock private RedisConnectionFactory connectionFactory;
  @Mock private RedisConnection connection;

  @Test
  void upWhenRedisAnswersPing() {
    when(connectionFactory.getConnection()).thenReturn(connection);
    when(connection.ping()).thenReturn("PONG");

    Health health = new TickLockHealthIndicator(connectionFactory).health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
  }

  @Test
  void unknownRatherThanDownWhenRedisIsUnreachable() {
    when(connectionFactory.getConnection())
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    Health health = new TickLockHealthIndicator(connectionFactory).health();

    assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
    assertThat(health.getDetails()).containsEntry("tickLock", "redis unreachable, ticks run unlocked");
  }
}
