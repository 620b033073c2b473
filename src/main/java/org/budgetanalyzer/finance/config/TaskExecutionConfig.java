package org.budgetanalyzer.finance.config;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.task.TaskExecutionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for request-scoped fan-out work.
 *
 * <p>Independent store reads (profile, currencies, user records) and per-currency rate lookups run
 * as {@code CompletableFuture}s on this pool and are joined before any aggregation starts. Pool
 * settings come from {@code spring.task.execution} properties in application.yml. When every
 * worker is busy and the queue is full, the submitting request thread runs the task itself, so a
 * burst of requests slows down instead of failing.
 *
 * <p>The SLF4J MDC of the submitting thread is copied into each task so log lines written by
 * worker threads keep the request's correlation id.
 */
@Configuration
public class TaskExecutionConfig {

  /** Bean name of the lookup executor. */
  public static final String LOOKUP_TASK_EXECUTOR = "lookupTaskExecutor";

  private final TaskExecutionProperties taskExecutionProperties;

  public TaskExecutionConfig(TaskExecutionProperties taskExecutionProperties) {
    this.taskExecutionProperties = taskExecutionProperties;
  }

  /**
   * Thread pool for fan-out reads and rate lookups.
   *
   * @return the configured executor
   */
  @Bean(name = LOOKUP_TASK_EXECUTOR)
  @NonNull
  public ThreadPoolTaskExecutor lookupTaskExecutor() {
    var executor = new ThreadPoolTaskExecutor();

    var pool = taskExecutionProperties.getPool();
    executor.setCorePoolSize(pool.getCoreSize());
    executor.setMaxPoolSize(pool.getMaxSize());
    executor.setQueueCapacity(pool.getQueueCapacity());
    executor.setKeepAliveSeconds((int) pool.getKeepAlive().getSeconds());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

    var shutdown = taskExecutionProperties.getShutdown();
    executor.setWaitForTasksToCompleteOnShutdown(shutdown.isAwaitTermination());
    if (shutdown.getAwaitTerminationPeriod() != null) {
      executor.setAwaitTerminationSeconds((int) shutdown.getAwaitTerminationPeriod().getSeconds());
    }

    executor.setThreadNamePrefix(taskExecutionProperties.getThreadNamePrefix());
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();

    return executor;
  }

  /** Copies the caller's MDC into the worker thread for the duration of a task. */
  static class MdcTaskDecorator implements TaskDecorator {

    @Override
    @NonNull
    public Runnable decorate(@NonNull Runnable runnable) {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        } else {
          MDC.clear();
        }
        try {
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    }
  }
}
