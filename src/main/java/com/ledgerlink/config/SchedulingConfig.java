package com.ledgerlink.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Bounded pool used by the per-link sync fan-out. */
  @Bean(name = "syncExecutor")
  public ThreadPoolTaskExecutor syncExecutor(SyncProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.parallelism());
    executor.setMaxPoolSize(properties.parallelism());
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("link-sync-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
