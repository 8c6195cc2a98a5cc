package com.flamingo.ai.manualkb.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async document processing and per-page extraction. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("doc-proc-");
    executor.initialize();
    return executor;
  }

  /**
   * Bounded pool for per-page entity extraction. A full queue runs the page on the submitting
   * thread.
   */
  @Bean(name = "pageExtractionExecutor")
  public Executor pageExtractionExecutor(ManualKbConfig config) {
    int workers = Math.max(1, config.getPipeline().getPageWorkers());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(workers * 16);
    executor.setThreadNamePrefix("page-extract-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
