package com.fourkites.webhook.scheduler.config;

import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;

/** Consumer side of the tick topic. Offsets are committed by the listener after each tick. */
@Configuration
@EnableKafka
public class KafkaConfig {

  private final String bootstrapServers;
  private final String groupId;
  private final int concurrency;

  public KafkaConfig(AppProperties appProps) {
    var kafka = appProps.kafka();
    this.bootstrapServers = kafka != null && kafka.bootstrapServers() != null ? kafka.bootstrapServers() : "localhost:9092";
    var consumer = kafka != null ? kafka.consumer() : null;
    this.groupId = consumer != null && consumer.groupId() != null ? consumer.groupId() : "webhook-tick-processors";
    this.concurrency = consumer != null && consumer.concurrency() != null ? consumer.concurrency() : 1;
  }

  @Bean
  public ConsumerFactory<String, String> consumerFactory() {
    Map<String, Object> configProps = new HashMap<>();
    configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    // A tick can wait on slow endpoints, so keep polls small and the poll interval generous
    configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 10);
    configProps.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 600000);
    configProps.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 3000);
    configProps.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);

    return new DefaultKafkaConsumerFactory<>(configProps);
  }

  @Bean
  public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory() {
    ConcurrentKafkaListenerContainerFactory<String, String> factory =
        new ConcurrentKafkaListenerContainerFactory<>();
    factory.setConsumerFactory(consumerFactory());
    factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
    factory.setConcurrency(concurrency);
    return factory;
  }
}
