package org.budgetanalyzer.finance.service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.finance.config.TaskExecutionConfig;
import org.budgetanalyzer.finance.exception.ServiceException;
import org.budgetanalyzer.finance.exception.ServiceUnavailableException;

/**
 * Runs independent store reads concurrently on the lookup executor.
 *
 * <p>Callers start every read first and then {@link #await} each one, so the reads overlap. A read
 * that fails for any reason other than a {@link ServiceException} is reported as a {@link
 * ServiceUnavailableException}; callers never build a partial page from the remaining reads.
 */
@Component
public class ParallelReader {

  private static final Logger log = LoggerFactory.getLogger(ParallelReader.class);

  private final Executor executor;

  public ParallelReader(@Qualifier(TaskExecutionConfig.LOOKUP_TASK_EXECUTOR) Executor executor) {
    this.executor = executor;
  }

  /**
   * Starts a read.
   *
   * @param read the read to run
   * @param <T> result type
   * @return future completing with the read's result
   */
  public <T> CompletableFuture<T> start(Supplier<T> read) {
    try {
      return CompletableFuture.supplyAsync(read, executor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Waits for a read started with {@link #start}.
   *
   * @param future the pending read
   * @param description what is being read, used in logs and error messages
   * @param <T> result type
   * @return the read's result
   * @throws ServiceUnavailableException if the read failed
   */
  public <T> T await(CompletableFuture<T> future, String description) {
    try {
      return future.join();
    } catch (CompletionException | CancellationException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof ServiceException serviceException) {
        throw serviceException;
      }

      log.error("Failed to read {}: {}", description, cause.getMessage(), cause);
      throw new ServiceUnavailableException(
          "Failed to read " + description, FinanceServiceError.TRANSPORT_FAILURE.name(), cause);
    }
  }
}
