package com.fourkites.webhook.scheduler.config;

import com.fourkites.webhook.scheduler.validation.ScheduleNotFoundException;
import com.fourkites.webhook.scheduler.validation.ScheduleValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /** Timer syntax and exactly-one-definition errors, keyed by field and returned as-is. */
  @ExceptionHandler(ScheduleValidationException.class)
  public ResponseEntity<Map<String, List<String>>> handleScheduleValidation(
      ScheduleValidationException ex) {
    log.warn("Schedule rejected: {}", ex.getErrors());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getErrors());
  }

  @ExceptionHandler(ScheduleNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(ScheduleNotFoundException ex) {
    log.debug("Schedule lookup failed: {}", ex.getMessage());

    Map<String, Object> body = baseBody("NOT_FOUND", ex.getMessage());
    body.put("id", ex.getScheduleId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
  }

  /** Bean Validation errors on request bodies */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
    log.warn("Validation failed for request: {}", ex.getMessage());

    Map<String, Object> body =
        baseBody("VALIDATION_FAILED", "Input validation failed. Please check the provided data.");
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
      fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
    }
    body.put("fieldErrors", fieldErrors);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> handleConstraintViolation(
      ConstraintViolationException ex) {
    log.warn("Constraint validation failed: {}", ex.getMessage());

    Map<String, Object> body = baseBody("CONSTRAINT_VIOLATION", "Data constraints violated");
    Map<String, String> violations =
        ex.getConstraintViolations().stream()
            .collect(
                Collectors.toMap(
                    violation -> violation.getPropertyPath().toString(),
                    ConstraintViolation::getMessage,
                    (first, ignored) -> first));
    body.put("violations", violations);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  /** Malformed JSON or a body that does not map onto the request type */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(baseBody("MALFORMED_REQUEST", "Request body is not valid JSON for this endpoint"));
  }

  /** Type conversion errors, e.g. a schedule id that is not a UUID */
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    log.warn("Type conversion failed for parameter '{}': {}", ex.getName(), ex.getMessage());

    String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "?";
    Map<String, Object> body =
        baseBody(
            "INVALID_FORMAT",
            String.format(
                "Invalid format for parameter '%s'. Expected type: %s", ex.getName(), expected));
    body.put("parameter", ex.getName());
    body.put("providedValue", ex.getValue());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  /** Business rule violations such as an unknown schedule type */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Business rule validation failed: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(baseBody("BUSINESS_RULE_VIOLATION", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
    log.error("Unexpected error occurred", ex);

    Map<String, Object> body =
        baseBody("INTERNAL_SERVER_ERROR", "An unexpected error occurred. Please try again later.");
    if (log.isDebugEnabled()) {
      body.put("debugMessage", ex.getMessage());
    }
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }

  private static Map<String, Object> baseBody(String error, String message) {
    Map<String, Object> body = new HashMap<>();
    body.put("error", error);
    body.put("message", message);
    body.put("timestamp", LocalDateTime.now(Clock.systemUTC()).toString());
    return body;
  }
}
