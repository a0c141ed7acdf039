package com.scholary.scribe.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for pipeline work.
 *
 * <p>The worker pool is bounded: when its queue is full, submissions are rejected and the request
 * is reported as busy. Each worker waits on at most one stage at a time, which bounds the live
 * stages. The stage pool itself grows on demand so that a stage thread still running after its
 * timeout never holds up another recording's stage.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "pipelineWorkerPool")
  public ThreadPoolTaskExecutor pipelineWorkerPool(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workers().threads());
    executor.setMaxPoolSize(properties.workers().threads());
    executor.setQueueCapacity(properties.workers().queueCapacity());
    executor.setThreadNamePrefix("pipeline-worker-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "pipelineStagePool", destroyMethod = "shutdownNow")
  public ExecutorService pipelineStagePool() {
    return Executors.newCachedThreadPool(new CustomizableThreadFactory("pipeline-stage-"));
  }
}
