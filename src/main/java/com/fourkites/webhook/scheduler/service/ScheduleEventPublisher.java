package com.fourkites.webhook.scheduler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fourkites.webhook.scheduler.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Sends {@code schedule.added} notifications for committed schedules. */
@Component
@Slf4j
public class ScheduleEventPublisher {

  static final String SCHEDULE_ADDED = "schedule.added";

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final ObjectMapper objectMapper;
  private final String topic;

  public ScheduleEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper, AppProperties appProps) {
    this.kafkaTemplate = kafkaTemplate;
    this.objectMapper = objectMapper;
    var kafka = appProps.kafka();
    this.topic =
        kafka != null && kafka.topics() != null && kafka.topics().scheduleEvents() != null
            ? kafka.topics().scheduleEvents()
            : "schedule-events";
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onScheduleCreated(ScheduleCreatedEvent event) {
    String key = event.schedule().id().toString();
    String message;
    try {
      message = toMessage(event);
    } catch (JsonProcessingException e) {
      // the schedule is already committed; only the notification is lost
      log.error("Could not serialize {} notification for schedule {}", SCHEDULE_ADDED, key, e);
      return;
    }

    kafkaTemplate
        .send(topic, key, message)
        .whenComplete(
            (result, ex) -> {
              if (ex != null) {
                log.error("Failed to publish {} for schedule {}", SCHEDULE_ADDED, key, ex);
              } else {
                log.debug("Published {} for schedule {} to {}", SCHEDULE_ADDED, key, topic);
              }
            });
  }

  String toMessage(ScheduleCreatedEvent event) throws JsonProcessingException {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("event", SCHEDULE_ADDED);
    root.set("data", objectMapper.valueToTree(event.schedule()));
    return objectMapper.writeValueAsString(root);
  }
}
