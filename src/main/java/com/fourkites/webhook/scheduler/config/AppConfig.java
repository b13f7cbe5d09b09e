package com.fourkites.webhook.scheduler.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AppConfig {

  private final String bootstrapServers;
  private final int maxConcurrentDeliveries;
  private final int connectTimeoutMs;
  private final int readTimeoutMs;

  public AppConfig(AppProperties appProps) {
    this.bootstrapServers =
        appProps.kafka() != null && appProps.kafka().bootstrapServers() != null
            ? appProps.kafka().bootstrapServers()
            : "localhost:9092";
    var tick = appProps.tick();
    this.maxConcurrentDeliveries =
        tick != null && tick.maxConcurrentDeliveries() != null && tick.maxConcurrentDeliveries() > 0
            ? tick.maxConcurrentDeliveries()
            : 16;
    var delivery = appProps.delivery();
    this.connectTimeoutMs =
        delivery != null && delivery.connectTimeoutMs() != null ? delivery.connectTimeoutMs() : 5000;
    this.readTimeoutMs =
        delivery != null && delivery.readTimeoutMs() != null ? delivery.readTimeoutMs() : 30000;
  }

  /** Bounded pool for webhook deliveries so one slow endpoint cannot starve a tick. */
  @Bean(name = "deliveryExecutor", destroyMethod = "shutdown")
  public ExecutorService deliveryExecutor() {
    return Executors.newFixedThreadPool(maxConcurrentDeliveries);
  }

  @Bean(name = "webhookRestTemplate")
  public RestTemplate webhookRestTemplate(RestTemplateBuilder builder) {
    return builder
        .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
        .setReadTimeout(Duration.ofMillis(readTimeoutMs))
        .build();
  }

  @Bean
  public ProducerFactory<String, String> producerFactory() {
    Map<String, Object> props = new HashMap<>();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    return new DefaultKafkaProducerFactory<>(props);
  }

  @Bean
  public KafkaTemplate<String, String> kafkaTemplate() {
    return new KafkaTemplate<>(producerFactory());
  }
}
