package dev.granary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Granary ingestion service.
 *
 * <p>Runs the webhook gateway and scheduler callback on the web port, the landing blob poller and
 * the source configuration refresh on the scheduling thread.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class GranaryApplication {
    public static void main(String[] args) {
        SpringApplication.run(GranaryApplication.class, args);
    }
}
