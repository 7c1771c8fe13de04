package org.imageintensity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

/**
 * Główna klasa startowa aplikacji Spring Boot.
 */
@SpringBootApplication
public class IntensityApplication {

    private static final Logger log = LoggerFactory.getLogger(IntensityApplication.class);

    private final Environment environment;

    public IntensityApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(IntensityApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void announceEndpoints() {
        String port = environment.getProperty("local.server.port", environment.getProperty("server.port", "3000"));
        log.info("Server running on http://localhost:{}", port);
        log.info("POST /calculate-intensity - Upload an image to calculate average intensity");
        log.info("GET  /health - Health check endpoint");
        log.info("GET  /swagger-ui - Swagger documentation UI");
    }
}
