package com.fourkites.webhook.scheduler.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-keyed validation errors for a schedule write, rendered as-is in the 400 response, e.g.
 * {@code {"cron_definition": ["... is not a valid crontab string: ..."]}}.
 */
public class ScheduleValidationException extends RuntimeException {

  public static final String NON_FIELD_ERRORS = "non_field_errors";

  private final Map<String, List<String>> errors;

  public ScheduleValidationException(Map<String, List<String>> errors) {
    super("Schedule validation failed: " + errors);
    this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
  }

  public static ScheduleValidationException of(String field, String message) {
    return new ScheduleValidationException(Map.of(field, List.of(message)));
  }

  public Map<String, List<String>> getErrors() {
    return errors;
  }
}
