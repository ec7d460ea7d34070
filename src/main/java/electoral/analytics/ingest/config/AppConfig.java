package electoral.analytics.ingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Application configuration for background import processing
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /**
     * Thread pool that runs admitted import jobs. The scheduler never hands it more
     * jobs than ingest.max-active-jobs, so the pool only needs that many threads.
     */
    @Bean(name = "importJobExecutor")
    public Executor importJobExecutor(ImportConfig importConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int slots = Math.max(1, importConfig.getMaxActiveJobs());
        executor.setCorePoolSize(slots);
        executor.setMaxPoolSize(slots);
        executor.setQueueCapacity(slots);
        executor.setThreadNamePrefix("Import-Job-");

        // Running jobs observe cancellation cooperatively; give them time to unwind
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        return executor;
    }

    // Note: multipart limits live in application.properties:
    // spring.servlet.multipart.max-file-size=1GB
    // spring.servlet.multipart.max-request-size=1GB
}
