package com.fourkites.webhook.scheduler.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** OpenAPI description of the schedule and tick endpoints. */
@Configuration
public class SwaggerConfig {

  private final String applicationName;
  private final String serverPort;

  public SwaggerConfig(AppProperties appProps) {
    this.applicationName = appProps.swagger() != null && appProps.swagger().applicationName() != null ? appProps.swagger().applicationName() : "webhook-scheduler";
    this.serverPort = appProps.swagger() != null && appProps.swagger().serverPort() != null ? appProps.swagger().serverPort() : "8080";
  }

  @Bean
  public OpenAPI customOpenAPI() {
    return new OpenAPI()
        .info(apiInfo())
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local Development Server")))
        .tags(
            List.of(
                new Tag().name("Schedules").description("Webhook schedule definitions"),
                new Tag().name("Ticks").description("Timer ticks and due-schedule inspection")));
  }

  private Info apiInfo() {
    return new Info()
        .title(applicationName + " API")
        .description(
            """
                ## Overview
                Stores cron and interval schedules and POSTs each schedule's JSON payload to its
                endpoint whenever the schedule's timer ticks.

                ### Schedule lifecycle:
                1. **enabled**: created with `triggered = 0`, selected on every tick of its timer
                2. each successful delivery increments `triggered`
                3. **disabled**: set in the same write that makes `triggered >= frequency`
                   (`frequency = 0` never disables)

                ### Delivery:
                - `POST <endpoint>` with `Authorization: Token <auth_token>` when a token is set
                - 2xx is success; 408, 429, 5xx and I/O errors are retried with backoff
                """)
        .version("v1.0.0");
  }
}
