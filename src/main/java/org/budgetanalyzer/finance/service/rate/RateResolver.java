package org.budgetanalyzer.finance.service.rate;

import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Resolves one exchange rate between two currencies.
 *
 * <p>Equal codes resolve to {@code 1.0} without consulting the store. Every other outcome is
 * reported as a {@link RateResolution}; no exception escapes for a missing rate or an unreachable
 * store, including a failure to open the lookup's transaction. Lookups are counted in {@code
 * exchange.rate.lookup}, tagged by outcome.
 */
@Service
public class RateResolver {

  private static final Logger log = LoggerFactory.getLogger(RateResolver.class);

  static final String LOOKUP_METRIC = "exchange.rate.lookup";

  private final RateLookup rateLookup;
  private final MeterRegistry meterRegistry;

  public RateResolver(RateLookup rateLookup, MeterRegistry meterRegistry) {
    this.rateLookup = rateLookup;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Resolves the rate from {@code sourceCurrency} to {@code targetCurrency} on a date.
   *
   * @param date rate date
   * @param sourceCurrency source currency code
   * @param targetCurrency target currency code
   * @return the resolution, never {@code null}
   */
  public RateResolution resolve(LocalDate date, String sourceCurrency, String targetCurrency) {
    if (sourceCurrency != null && sourceCurrency.equals(targetCurrency)) {
      return RateResolution.found(sourceCurrency, targetCurrency, 1.0);
    }

    var resolution = lookup(date, sourceCurrency, targetCurrency);
    Counter.builder(LOOKUP_METRIC)
        .description("Exchange rate lookups against the rate store")
        .tag("outcome", resolution.outcomeTag())
        .register(meterRegistry)
        .increment();
    return resolution;
  }

  private RateResolution lookup(LocalDate date, String sourceCurrency, String targetCurrency) {
    try {
      var rate = rateLookup.lookupRate(date, sourceCurrency, targetCurrency);

      if (rate.isEmpty()) {
        log.warn(
            "Exchange rate not found for {} -> {} on {}", sourceCurrency, targetCurrency, date);
        return RateResolution.notFound(
            sourceCurrency,
            targetCurrency,
            "No exchange rate for " + sourceCurrency + " -> " + targetCurrency + " on " + date);
      }

      var value = rate.getAsDouble();
      if (!Double.isFinite(value) || value <= 0) {
        log.warn(
            "Ignoring unusable exchange rate {} for {} -> {} on {}",
            value,
            sourceCurrency,
            targetCurrency,
            date);
        return RateResolution.invalidRate(
            sourceCurrency,
            targetCurrency,
            "Unusable exchange rate " + value + " for " + sourceCurrency + " -> " + targetCurrency);
      }

      return RateResolution.found(sourceCurrency, targetCurrency, value);
    } catch (RateLookupException | DataAccessException | TransactionException e) {
      log.error(
          "Failed to look up exchange rate {} -> {} on {}: {}",
          sourceCurrency,
          targetCurrency,
          date,
          e.getMessage(),
          e);
      return RateResolution.transportFailure(sourceCurrency, targetCurrency, e.getMessage());
    }
  }
}
