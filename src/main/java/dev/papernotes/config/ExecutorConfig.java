package dev.papernotes.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool shared by the ingestion and query pipelines for model calls and index lookups.
 *
 * <p>When the queue is full the submitting thread runs the task itself, so a burst of pipeline
 * runs slows down instead of failing.
 */
@Configuration
public class ExecutorConfig {

  @Bean(name = "embeddingExecutor")
  public ThreadPoolTaskExecutor embeddingExecutor(
      @Value("${papernotes.executor.core-pool-size:4}") int corePoolSize,
      @Value("${papernotes.executor.max-pool-size:8}") int maxPoolSize,
      @Value("${papernotes.executor.queue-capacity:100}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("embedding-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
