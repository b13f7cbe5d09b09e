package com.fourkites.webhook.scheduler.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Constraint;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requires a webhook payload to be a JSON object and limits its serialized size and nesting
 * depth. The validator is nested so the constraint lives in one file.
 */
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = JsonPayloadSize.Validator.class)
@Documented
public @interface JsonPayloadSize {
  String message() default "Webhook payload exceeds maximum allowed size";

  Class<?>[] groups() default {};

  Class<? extends Payload>[] payload() default {};

  /** Maximum serialized size in kilobytes */
  int maxSizeKB() default 64;

  /** Maximum nesting depth of objects and arrays */
  int maxDepth() default 16;

  class Validator implements ConstraintValidator<JsonPayloadSize, JsonNode> {

    private static final Logger log = LoggerFactory.getLogger(Validator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private int maxBytes;
    private int maxSizeKB;
    private int maxDepth;

    @Override
    public void initialize(JsonPayloadSize annotation) {
      this.maxSizeKB = annotation.maxSizeKB();
      this.maxBytes = annotation.maxSizeKB() * 1024;
      this.maxDepth = annotation.maxDepth();
    }

    @Override
    public boolean isValid(JsonNode payload, ConstraintValidatorContext context) {
      if (payload == null || payload.isNull()) {
        return true; // null payloads default to {}
      }
      if (!payload.isObject()) {
        return reject(context, "Webhook payload must be a JSON object");
      }

      int size;
      try {
        size = MAPPER.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8).length;
      } catch (JsonProcessingException e) {
        log.warn("Webhook payload could not be serialized: {}", e.getOriginalMessage());
        return reject(context, "Webhook payload is not serializable JSON");
      }

      if (size > maxBytes) {
        log.warn("Webhook payload of {} bytes exceeds {}KB", size, maxSizeKB);
        return reject(
            context,
            String.format(
                "Webhook payload size %d bytes exceeds maximum allowed size of %dKB",
                size, maxSizeKB));
      }

      if (depthOf(payload) > maxDepth) {
        return reject(
            context,
            "Webhook payload nesting depth exceeds maximum allowed (" + maxDepth + " levels)");
      }
      return true;
    }

    private static boolean reject(ConstraintValidatorContext context, String message) {
      context.disableDefaultConstraintViolation();
      context.buildConstraintViolationWithTemplate(message).addConstraintViolation();
      return false;
    }

    private static int depthOf(JsonNode node) {
      if (!node.isContainerNode()) {
        return 0;
      }
      int deepest = 0;
      for (JsonNode child : node) {
        deepest = Math.max(deepest, depthOf(child));
      }
      return deepest + 1;
    }
  }
}
