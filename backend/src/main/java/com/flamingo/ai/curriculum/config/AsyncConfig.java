package com.flamingo.ai.curriculum.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for concurrent imports. */
@Configuration
public class AsyncConfig {

  /** Runs one independent import pipeline per subject of a batch. */
  @Bean(name = "importExecutor")
  public Executor importExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("import-");
    executor.initialize();
    return executor;
  }
}
