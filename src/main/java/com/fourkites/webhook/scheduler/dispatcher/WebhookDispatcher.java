package com.fourkites.webhook.scheduler.dispatcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs a schedule's payload to its endpoint. Transient failures (408, 429, 5xx, I/O errors) are
 * retried with exponential backoff; everything else fails on the first attempt. Nothing is
 * persisted here.
 */
@Component
public class WebhookDispatcher {
  private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final DeliveryRetryPolicy retryPolicy;

  public WebhookDispatcher(
      @Qualifier("webhookRestTemplate") RestTemplate restTemplate,
      ObjectMapper objectMapper,
      DeliveryRetryPolicy retryPolicy) {
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
    this.retryPolicy = retryPolicy;
  }

  public DeliveryResult deliver(String endpoint, JsonNode payload, String authToken) {
    String body;
    try {
      body = payload == null ? "{}" : objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      return DeliveryResult.failed(0, null, "payload not serializable: " + e.getOriginalMessage(), false);
    }
    HttpEntity<String> request = new HttpEntity<>(body, headers(authToken));

    int maxAttempts = retryPolicy.getMaxAttempts();
    DeliveryResult last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      last = attempt(endpoint, request, attempt);
      if (last.success() || !last.transientFailure() || attempt == maxAttempts) {
        break;
      }

      Duration delay = retryPolicy.delayAfter(attempt);
      log.debug(
          "Retrying webhook {} in {} ms after attempt {} ({})",
          endpoint,
          delay.toMillis(),
          attempt,
          last.reason());
      if (!pause(delay)) {
        return DeliveryResult.failed(attempt, last.statusCode(), "interrupted during backoff", true);
      }
    }
    return last;
  }

  private DeliveryResult attempt(String endpoint, HttpEntity<String> request, int attempt) {
    try {
      ResponseEntity<String> response =
          restTemplate.exchange(endpoint, HttpMethod.POST, request, String.class);
      return classify(response.getStatusCode().value(), attempt);
    } catch (RestClientResponseException e) {
      return classify(e.getStatusCode().value(), attempt);
    } catch (ResourceAccessException e) {
      return DeliveryResult.failed(attempt, null, "I/O error: " + e.getMessage(), true);
    } catch (RestClientException | IllegalArgumentException e) {
      // malformed endpoint or unusable response, another attempt would not help
      return DeliveryResult.failed(attempt, null, "request failed: " + e.getMessage(), false);
    }
  }

  private DeliveryResult classify(int statusCode, int attempt) {
    if (statusCode >= 200 && statusCode < 300) {
      return DeliveryResult.delivered(attempt, statusCode);
    }
    return DeliveryResult.failed(
        attempt, statusCode, "HTTP " + statusCode, retryPolicy.isRetryableStatus(statusCode));
  }

  private HttpHeaders headers(String authToken) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    if (authToken != null && !authToken.isBlank()) {
      headers.set(HttpHeaders.AUTHORIZATION, "Token " + authToken);
    }
    return headers;
  }

  private static boolean pause(Duration delay) {
    if (delay.isZero()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
