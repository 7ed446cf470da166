package dev.sirchmunk.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables scheduled cluster maintenance unless {@code sirchmunk.cluster.maintenance-enabled} is
 * false.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(
    prefix = "sirchmunk.cluster",
    name = "maintenance-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulingConfig {}
