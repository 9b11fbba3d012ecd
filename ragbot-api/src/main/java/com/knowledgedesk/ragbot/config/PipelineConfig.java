package com.knowledgedesk.ragbot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class PipelineConfig {

    @Bean(name = "eventProcessingExecutor")
    public Executor eventProcessingExecutor(RagbotProperties properties) {
        RagbotProperties.Worker worker = properties.worker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.corePoolSize());
        executor.setMaxPoolSize(worker.maxPoolSize());
        executor.setQueueCapacity(worker.queueCapacity());
        executor.setThreadNamePrefix("event-proc-");
        // a full queue must refuse the event so the router can answer 503 and Slack retries it later
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
