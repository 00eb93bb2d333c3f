package com.jarvisbot.telegram.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for Telegram updates.
 *
 * <p>Audio ingest may block for minutes on the fast path, so updates never run on the webhook or
 * polling thread.
 */
@Configuration
public class DispatchConfig {

  @Bean(name = "updateExecutor")
  public ThreadPoolTaskExecutor updateExecutor(
      @Value("${telegram.dispatch.core-pool-size:4}") int corePoolSize,
      @Value("${telegram.dispatch.max-pool-size:16}") int maxPoolSize,
      @Value("${telegram.dispatch.queue-capacity:200}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("update-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
