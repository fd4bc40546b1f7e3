package com.eyelevel.bordereaux;

import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the bordereaux processor.
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds "app.processing" to {@link BordereauxProcessingConfig}.</li>
 *     <li>{@link EnableScheduling}: batch runs and stale-claim recovery.</li>
 *     <li>{@link EnableRetry}: retried blob-store reads.</li>
 *     <li>{@link EnableJpaRepositories}: repositories under the repository package.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.bordereaux.repository")
@EnableConfigurationProperties(value = BordereauxProcessingConfig.class)
@EnableRetry
public class BordereauxProcessorApplication {

    public static void main(final String[] args) {
        log.info("Starting BordereauxProcessorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(BordereauxProcessorApplication.class,
                                                                             args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "BordereauxProcessor"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
