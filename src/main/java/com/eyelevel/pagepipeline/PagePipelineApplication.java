package com.eyelevel.pagepipeline;

import com.eyelevel.pagepipeline.config.DocumentProcessingConfig;
import com.eyelevel.pagepipeline.config.MaintenanceConfig;
import com.eyelevel.pagepipeline.config.RenderingConfig;
import com.eyelevel.pagepipeline.config.StorageConfig;
import com.eyelevel.pagepipeline.config.TaskManagerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Page Pipeline Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the {@code app.*} property groups to their
 *     strongly-typed configuration classes.</li>
 *     <li>{@link EnableScheduling}: activates periodic maintenance such as sweeping finished background tasks
 *     and orphaned media.</li>
 *     <li>{@link EnableJpaRepositories}: configures the base package for Spring Data JPA repositories.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.pagepipeline.repository")
@EnableConfigurationProperties(value = {DocumentProcessingConfig.class, RenderingConfig.class,
        TaskManagerConfig.class, StorageConfig.class, MaintenanceConfig.class})
public class PagePipelineApplication {

    public static void main(final String[] args) {
        log.info("Starting PagePipelineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(PagePipelineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "PagePipeline"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
