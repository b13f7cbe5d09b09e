package com.fourkites.webhook.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WebhookSchedulerApplication {
  public static void main(String[] args) {
    SpringApplication.run(WebhookSchedulerApplication.class, args);
  }
}
