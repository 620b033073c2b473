package org.budgetanalyzer.finance.service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.finance.config.FinanceServiceProperties;
import org.budgetanalyzer.finance.engine.ConversionContext;
import org.budgetanalyzer.finance.engine.CurrencyInfo;
import org.budgetanalyzer.finance.engine.CurrencyRegistry;
import org.budgetanalyzer.finance.exception.ServiceUnavailableException;
import org.budgetanalyzer.finance.service.rate.RateBatchResolver;

/**
 * Builds the conversion context of a request.
 *
 * <p>Rates are resolved from the base reporting currency to every active currency plus the display
 * currency. Missing individual rates are tolerated and degrade only the amounts that need them,
 * but a request without any currency metadata or without a single resolvable rate fails with a
 * {@link ServiceUnavailableException}.
 */
@Service
public class ConversionContextFactory {

  private static final Logger log = LoggerFactory.getLogger(ConversionContextFactory.class);

  private final RateBatchResolver rateBatchResolver;
  private final String baseCurrency;
  private final String defaultDisplayCurrency;

  public ConversionContextFactory(
      RateBatchResolver rateBatchResolver, FinanceServiceProperties properties) {
    this.rateBatchResolver = rateBatchResolver;
    this.baseCurrency = properties.getCurrency().getBaseReportingCurrency();
    this.defaultDisplayCurrency = properties.getCurrency().getDefaultDisplayCurrency();
  }

  /**
   * Builds a context from already loaded currency metadata.
   *
   * @param rateDate date of the rates to use
   * @param preferredCurrency user's display currency, {@code null} or blank for the default
   * @param currencies active currency metadata
   * @return the context
   * @throws ServiceUnavailableException if there is no currency metadata or no rate at all
   */
  public ConversionContext create(
      LocalDate rateDate, String preferredCurrency, Collection<CurrencyInfo> currencies) {
    return create(rateDate, preferredCurrency, currencies, List.of());
  }

  /**
   * Builds a context that also resolves rates for currencies outside the metadata list, such as
   * the native currencies of records in deactivated currencies.
   *
   * @param rateDate date of the rates to use
   * @param preferredCurrency user's display currency, {@code null} or blank for the default
   * @param currencies currency metadata
   * @param additionalCurrencies further codes whose rates are needed
   * @return the context
   * @throws ServiceUnavailableException if there is no currency metadata or no rate at all
   */
  public ConversionContext create(
      LocalDate rateDate,
      String preferredCurrency,
      Collection<CurrencyInfo> currencies,
      Collection<String> additionalCurrencies) {
    var registry = CurrencyRegistry.of(currencies);
    if (registry.isEmpty()) {
      log.error("No currency metadata available, cannot render amounts");
      throw new ServiceUnavailableException(
          "Currency metadata is unavailable",
          FinanceServiceError.CURRENCY_METADATA_UNAVAILABLE.name());
    }

    var displayCurrency = resolveDisplayCurrency(preferredCurrency);

    var targets = new LinkedHashSet<>(registry.codes());
    targets.add(displayCurrency);
    additionalCurrencies.stream().filter(Objects::nonNull).forEach(targets::add);

    var batch = rateBatchResolver.resolveMany(rateDate, targets, baseCurrency);
    if (batch.hasError()) {
      var failure = batch.error().get();
      throw new ServiceUnavailableException(
          "Exchange rates are unavailable for " + rateDate + ": " + failure.message(),
          FinanceServiceError.EXCHANGE_RATES_UNAVAILABLE.name());
    }

    if (!batch.rates().contains(displayCurrency)) {
      log.warn(
          "No {} -> {} rate for {}, amounts will render as fallback",
          baseCurrency,
          displayCurrency,
          rateDate);
    }

    return new ConversionContext(registry, batch.rates(), baseCurrency, displayCurrency);
  }

  /**
   * Display currency for a user preference.
   *
   * @param preferredCurrency stored preference, may be {@code null}
   * @return the preference, or the configured default when unset
   */
  public String resolveDisplayCurrency(String preferredCurrency) {
    if (preferredCurrency == null || preferredCurrency.isBlank()) {
      return defaultDisplayCurrency;
    }
    return preferredCurrency.trim();
  }
}
