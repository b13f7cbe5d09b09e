package com.fourkites.webhook.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
    Kafka kafka,
    Tick tick,
    Delivery delivery,
    Db db,
    Swagger swagger) {

  public record Kafka(
      String bootstrapServers,
      Topics topics,
      Consumer consumer) {
    public record Topics(String ticks, String scheduleEvents) { }
    public record Consumer(String groupId, Integer concurrency) { }
  }

  public record Tick(
      Long timeoutSeconds, Integer maxConcurrentDeliveries, Boolean lockEnabled, Long lockTtlSeconds) { }

  public record Delivery(
      Integer maxAttempts, Long baseDelayMs, Long maxDelayMs, Integer connectTimeoutMs, Integer readTimeoutMs) { }

  public record Db(Integer maxRetries, Long retryBaseDelayMs) { }

  public record Swagger(String applicationName, String serverPort) { }
}
