package com.fourkites.webhook.scheduler.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fourkites.webhook.scheduler.model.ScheduleKind;
import com.fourkites.webhook.scheduler.model.TimerRef;
import com.fourkites.webhook.scheduler.service.ScheduleFiringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Receives timer ticks from the external trigger. A tick is either {@code
 * {"schedule_type":"crontab","lookup_id":1}} or the compact {@code crontab:1}.
 */
@Component
public class TickKafkaListener {

  private static final Logger log = LoggerFactory.getLogger(TickKafkaListener.class);

  private final ScheduleFiringService firingService;
  private final ObjectMapper objectMapper;

  public TickKafkaListener(ScheduleFiringService firingService, ObjectMapper objectMapper) {
    this.firingService = firingService;
    this.objectMapper = objectMapper;
  }

  @KafkaListener(
      topics = "${app.kafka.topics.ticks:schedule-ticks}",
      groupId = "${app.kafka.consumer.group-id:webhook-tick-processors}")
  public void onTick(
      @Payload String message,
      @Header(name = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
      Acknowledgment acknowledgment) {

    TimerRef timer;
    try {
      timer = parse(message);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.error("Discarding malformed tick message: {}", message, e);
      acknowledgment.acknowledge(); // redelivery would fail the same way
      return;
    }

    log.debug("Received tick {} from partition {}", timer, partition);
    try {
      ScheduleFiringService.FiringReport report =
          firingService.runTick(timer.kind(), timer.lookupId());
      log.info("Tick {}: {}{}", timer, report.getMessage(), report.isSkipped() ? " (skipped)" : "");
      acknowledgment.acknowledge();
    } catch (Exception e) {
      log.error("Error processing tick {}", timer, e);
      // not acknowledged, Kafka redelivers
      throw new RuntimeException("Failed to process tick " + timer, e);
    }
  }

  TimerRef parse(String message) throws JsonProcessingException {
    if (message == null || message.isBlank()) {
      throw new IllegalArgumentException("Empty tick message");
    }
    String trimmed = message.trim();
    if (!trimmed.startsWith("{")) {
      return TimerRef.parse(trimmed);
    }

    JsonNode node = objectMapper.readTree(trimmed);
    JsonNode type = node.get("schedule_type");
    JsonNode lookupId = node.get("lookup_id");
    if (type == null || !type.isTextual() || lookupId == null || !lookupId.canConvertToLong()) {
      throw new IllegalArgumentException(
          "Tick message needs a schedule_type string and an integer lookup_id");
    }
    return new TimerRef(ScheduleKind.fromValue(type.asText()), lookupId.asLong());
  }
}
