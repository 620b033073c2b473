package org.budgetanalyzer.finance.service.rate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.finance.config.TaskExecutionConfig;
import org.budgetanalyzer.finance.engine.RateMap;

/**
 * Resolves rates from a base currency to many target currencies at once.
 *
 * <p>Lookups run concurrently on the lookup executor and are all joined before the rate map is
 * built. A currency whose rate is missing or failed is omitted from the map; the batch itself only
 * fails when nothing beyond the base currency resolved and at least one lookup could not reach the
 * store.
 */
@Service
public class RateBatchResolver {

  private static final Logger log = LoggerFactory.getLogger(RateBatchResolver.class);

  private final RateResolver rateResolver;
  private final Executor lookupExecutor;

  public RateBatchResolver(
      RateResolver rateResolver,
      @Qualifier(TaskExecutionConfig.LOOKUP_TASK_EXECUTOR) Executor lookupExecutor) {
    this.rateResolver = rateResolver;
    this.lookupExecutor = lookupExecutor;
  }

  /**
   * Resolves {@code baseCurrency -> target} for each target on a date.
   *
   * @param date rate date
   * @param targetCurrencies target currency codes, duplicates and {@code null}s ignored
   * @param baseCurrency base currency code
   * @return resolved rates in request order, with an error only when nothing could be resolved
   */
  public RateBatchResult resolveMany(
      LocalDate date, Collection<String> targetCurrencies, String baseCurrency) {
    var targets = new LinkedHashSet<String>();
    if (targetCurrencies != null) {
      for (var target : targetCurrencies) {
        if (target != null) {
          targets.add(target);
        }
      }
    }

    var pending = new LinkedHashMap<String, CompletableFuture<RateResolution>>();
    for (var target : targets) {
      if (!target.equals(baseCurrency)) {
        pending.put(target, submit(date, baseCurrency, target));
      }
    }

    var rates = new LinkedHashMap<String, Double>();
    var failures = new ArrayList<RateFailure>();
    var resolvedCount = 0;

    for (var target : targets) {
      if (target.equals(baseCurrency)) {
        rates.put(target, 1.0);
        continue;
      }

      var resolution = join(pending.get(target), baseCurrency, target);
      if (resolution.isFound()) {
        rates.put(target, resolution.rate());
        resolvedCount++;
      } else {
        log.warn(
            "Omitting {} from rates for {}: {} ({})",
            target,
            date,
            resolution.error(),
            resolution.message());
        if (resolution.isTransportFailure()) {
          failures.add(resolution.toFailure());
        }
      }
    }

    Optional<RateFailure> error = Optional.empty();
    if (resolvedCount == 0 && !failures.isEmpty()) {
      error = Optional.of(failures.get(0));
      log.error(
          "No exchange rate could be resolved for {} on {}, first failure: {}",
          pending.keySet(),
          date,
          error.get().message());
    } else if (!failures.isEmpty()) {
      log.info(
          "Resolved {} of {} exchange rates for {} despite {} lookup failure(s)",
          resolvedCount,
          pending.size(),
          date,
          failures.size());
    }

    return new RateBatchResult(date, RateMap.of(rates), error);
  }

  private CompletableFuture<RateResolution> submit(LocalDate date, String base, String target) {
    try {
      return CompletableFuture.supplyAsync(
          () -> rateResolver.resolve(date, base, target), lookupExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static RateResolution join(
      CompletableFuture<RateResolution> future, String base, String target) {
    try {
      return future.join();
    } catch (CompletionException | CancellationException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      log.error("Rate lookup task for {} -> {} did not complete", base, target, cause);
      return RateResolution.transportFailure(
          base, target, "Rate lookup did not complete: " + cause.getMessage());
    }
  }
}
