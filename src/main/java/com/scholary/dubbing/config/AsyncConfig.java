package com.scholary.dubbing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: one runs whole dubbing jobs, the other fans out per-utterance
 * translate-and-synthesize calls. A full queue rejects new work instead of growing without bound.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "pipelineExecutor")
  public ThreadPoolTaskExecutor pipelineExecutor(DubbingProperties properties) {
    return boundedPool(
        properties.pipelineThreads(), properties.pipelineQueueSize(), "dubbing-");
  }

  @Bean(name = "synthesisExecutor")
  public ThreadPoolTaskExecutor synthesisExecutor(DubbingProperties properties) {
    return boundedPool(
        properties.synthesis().concurrency(), properties.synthesis().queueSize(), "synthesis-");
  }

  private static ThreadPoolTaskExecutor boundedPool(int threads, int queueSize, String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(prefix);
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
