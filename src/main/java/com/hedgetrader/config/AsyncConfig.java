package com.hedgetrader.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /** Runs one task per trading pair on each monitoring tick. */
    @Bean("pairEvaluationExecutor")
    public ThreadPoolTaskExecutor pairEvaluationExecutor(EngineProperties engineProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(engineProperties.getPairEvaluationThreads());
        executor.setMaxPoolSize(engineProperties.getPairEvaluationThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("pair-eval-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
