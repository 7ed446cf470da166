package dev.sirchmunk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Sirchmunk retrieval engine.
 *
 * <p>Runs without a web server. The public surface is {@link
 * dev.sirchmunk.search.SearchOrchestrator}; UI, REST and protocol adapters are separate
 * collaborators that embed this application context.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SirchmunkApplication {
    public static void main(String[] args) {
        SpringApplication.run(SirchmunkApplication.class, args);
    }
}
