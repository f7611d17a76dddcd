package dev.univer.expensebot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Updates are handled off the polling thread so that chats do not wait on each other. */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    public static final String UPDATE_EXECUTOR = "updateExecutor";

    @Bean(name = UPDATE_EXECUTOR)
    public TaskExecutor updateExecutor(@Value("${bot.executor.core-size:4}") int coreSize,
                                       @Value("${bot.executor.max-size:16}") int maxSize,
                                       @Value("${bot.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("update-");
        executor.setRejectedExecutionHandler((r, e) -> log.error("Update rejected, pool and queue are full"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Update executor ready: core={}, max={}, queue={}", coreSize, maxSize, queueCapacity);
        return executor;
    }
}
