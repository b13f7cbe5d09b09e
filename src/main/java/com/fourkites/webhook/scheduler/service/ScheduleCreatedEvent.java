package com.fourkites.webhook.scheduler.service;

import com.fourkites.webhook.scheduler.dto.ScheduleResponse;

/** Published inside the create transaction; forwarded to Kafka once it commits. */
public record ScheduleCreatedEvent(ScheduleResponse schedule) { }
