package email.assistant.app.config;

import email.assistant.app.service.CapabilityGuard;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Thread pools for the retrieval fan-out and for bounding calls into the mailbox and
 * model capabilities.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "retrievalExecutor")
    public ThreadPoolTaskExecutor retrievalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("retrieval-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "capabilityExecutor")
    public ThreadPoolTaskExecutor capabilityExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("capability-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public CapabilityGuard capabilityGuard(@Qualifier("capabilityExecutor") AsyncTaskExecutor capabilityExecutor,
                                           AssistantProperties properties) {
        return new CapabilityGuard(
                capabilityExecutor,
                properties.getCapability().getTimeout(),
                properties.getCapability().getRetryBackoff());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
