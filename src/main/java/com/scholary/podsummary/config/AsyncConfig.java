package com.scholary.podsummary.config;

import com.scholary.podsummary.ingest.IngestProperties;
import com.scholary.podsummary.pipeline.PipelineProperties;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for background work.
 *
 * <ul>
 *   <li>{@code pipelineExecutor}: one task per job run, bounded queue. A full queue rejects the
 *       launch, which fails the job instead of blocking the request thread.
 *   <li>{@code stageExecutor}: adapter calls, so a call that overruns its timeout can be abandoned
 *       without losing the pipeline thread's ability to record the failure.
 *   <li>{@code ingestExecutor}: URL downloads.
 * </ul>
 *
 * <p>All three copy the submitting thread's MDC into the worker so job ids stay on log lines.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, IngestProperties.class})
public class AsyncConfig {

  @Bean(name = "pipelineExecutor")
  public ThreadPoolTaskExecutor pipelineExecutor(PipelineProperties properties) {
    return executor(
        "pipeline-",
        properties.executorThreads(),
        properties.executorQueueSize(),
        properties.shutdownAwaitSeconds());
  }

  @Bean(name = "stageExecutor")
  public ThreadPoolTaskExecutor stageExecutor(PipelineProperties properties) {
    return executor(
        "stage-",
        properties.stageExecutorThreads(),
        Integer.MAX_VALUE,
        properties.shutdownAwaitSeconds());
  }

  @Bean(name = "ingestExecutor")
  public ThreadPoolTaskExecutor ingestExecutor(
      IngestProperties properties, PipelineProperties pipelineProperties) {
    return executor(
        "ingest-",
        properties.executorThreads(),
        Integer.MAX_VALUE,
        pipelineProperties.shutdownAwaitSeconds());
  }

  private static ThreadPoolTaskExecutor executor(
      String prefix, int threads, int queueSize, int awaitSeconds) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(prefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitSeconds);
    executor.setTaskDecorator(mdcPropagating());
    return executor;
  }

  static TaskDecorator mdcPropagating() {
    return runnable -> {
      Map<String, String> contextMap = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        try {
          if (contextMap != null) {
            MDC.setContextMap(contextMap);
          } else {
            MDC.clear();
          }
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
