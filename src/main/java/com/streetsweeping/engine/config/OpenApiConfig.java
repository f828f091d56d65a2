package com.streetsweeping.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI streetSweepingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Street Sweeping Schedule API")
                        .description("Resolves the street-cleaning restriction for a parked car and " +
                                "schedules reminders ahead of each cleaning.\n\n" +
                                "## Resolution\n\n" +
                                "1. Candidate segments are looked up in a uniform lat/lon grid\n" +
                                "2. The closest segment within 50 ft wins, and the side of the street is " +
                                "derived from the segment direction\n" +
                                "3. Rules on the same block and side are ranked by their next cleaning\n\n" +
                                "## Reminders\n\n" +
                                "Reminder preferences are offsets from the cleaning start (or end). " +
                                "Scheduling a location turns every active preference into a concrete " +
                                "reminder instant.\n\n" +
                                "Connect to `ws://localhost:" + serverPort + "/ws/reminders` and subscribe to " +
                                "`/topic/reminders` to receive reminders when they become due.")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
