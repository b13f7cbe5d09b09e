package com.fourkites.webhook.scheduler.service;

import com.fourkites.webhook.scheduler.config.AppProperties;
import com.fourkites.webhook.scheduler.model.TimerRef;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

/**
 * Redis lock that serializes overlapping ticks of the same timer across instances. When Redis is
 * unavailable the tick runs unlocked; per-schedule writes are versioned, so overlap cannot push a
 * counter past its frequency.
 */
@Service
public class TickLockService {

  private static final Logger log = LoggerFactory.getLogger(TickLockService.class);
  private static final String TICK_LOCK_PREFIX = "tick_lock:";

  private static final RedisScript<Long> RELEASE_SCRIPT =
      new DefaultRedisScript<>(
          "if redis.call('get', KEYS[1]) == ARGV[1] then "
              + "    return redis.call('del', KEYS[1]) "
              + "else "
              + "    return 0 "
              + "end",
          Long.class);

  private final StringRedisTemplate redisTemplate;
  private final boolean enabled;
  private final Duration ttl;

  public TickLockService(StringRedisTemplate redisTemplate, AppProperties appProps) {
    this.redisTemplate = redisTemplate;
    var tick = appProps.tick();
    this.enabled = tick == null || tick.lockEnabled() == null || tick.lockEnabled();
    long ttlSeconds = tick != null && tick.lockTtlSeconds() != null ? tick.lockTtlSeconds() : 300L;
    this.ttl = Duration.ofSeconds(ttlSeconds);
  }

  public TickLock acquire(TimerRef timer) {
    String lockKey = TICK_LOCK_PREFIX + timer;
    if (!enabled) {
      return TickLock.unlocked(lockKey);
    }

    String lockValue = Thread.currentThread().getName() + "-" + UUID.randomUUID();
    try {
      Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, lockValue, ttl);
      if (Boolean.TRUE.equals(acquired)) {
        log.debug("Acquired tick lock {}", lockKey);
        return new TickLock(true, lockKey, lockValue);
      }
      log.info("Tick lock {} is held by another tick, skipping", lockKey);
      return new TickLock(false, lockKey, null);
    } catch (RuntimeException e) {
      log.warn("Tick lock backend unavailable, running {} unlocked: {}", timer, e.getMessage());
      return TickLock.unlocked(lockKey);
    }
  }

  /** Deletes the lock key only if this tick still owns it. */
  public boolean release(TickLock lock) {
    if (!lock.isAcquired() || lock.getLockValue() == null) {
      return false;
    }
    try {
      Long result = redisTemplate.execute(RELEASE_SCRIPT, List.of(lock.getLockKey()), lock.getLockValue());
      boolean released = Long.valueOf(1).equals(result);
      if (!released) {
        log.warn("Tick lock {} expired before the tick finished", lock.getLockKey());
      }
      return released;
    } catch (RuntimeException e) {
      log.warn("Could not release tick lock {}: {}", lock.getLockKey(), e.getMessage());
      return false;
    }
  }

  /** Result of a lock attempt. An unlocked tick is allowed to run but has nothing to release. */
  public static class TickLock {
    private final boolean acquired;
    private final String lockKey;
    private final String lockValue;

    public TickLock(boolean acquired, String lockKey, String lockValue) {
      this.acquired = acquired;
      this.lockKey = lockKey;
      this.lockValue = lockValue;
    }

    static TickLock unlocked(String lockKey) {
      return new TickLock(true, lockKey, null);
    }

    public boolean isAcquired() {
      return acquired;
    }

    public String getLockKey() {
      return lockKey;
    }

    public String getLockValue() {
      return lockValue;
    }
  }
}
