package eu.hhmmss.devactivity.config;

import eu.hhmmss.devactivity.report.EstimationCollaborator;
import eu.hhmmss.devactivity.report.NoOpEstimationCollaborator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Supplies a do-nothing estimator unless the application context defines a real one.
 */
@Configuration
@Slf4j
public class EstimationConfig {

    @Bean
    @ConditionalOnMissingBean(EstimationCollaborator.class)
    public EstimationCollaborator estimationCollaborator() {
        log.info("No EstimationCollaborator configured, task estimation is disabled");
        return new NoOpEstimationCollaborator();
    }
}
