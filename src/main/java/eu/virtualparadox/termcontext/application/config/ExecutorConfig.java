package eu.virtualparadox.termcontext.application.config;

import eu.virtualparadox.termcontext.application.executor.ContextExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public ContextExecutor contextExecutor(final ApplicationConfig config) {
        ContextExecutor executor = new ContextExecutor();
        executor.setCorePoolSize(config.getWorkerPoolSize());
        executor.setMaxPoolSize(config.getWorkerPoolSize());  // fixed size
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("context-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
