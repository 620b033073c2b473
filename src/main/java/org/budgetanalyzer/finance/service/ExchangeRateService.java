package org.budgetanalyzer.finance.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.finance.config.FinanceServiceProperties;
import org.budgetanalyzer.finance.engine.ConversionContext;
import org.budgetanalyzer.finance.engine.ConversionResult;
import org.budgetanalyzer.finance.engine.CurrencyConverter;
import org.budgetanalyzer.finance.engine.CurrencyInfo;
import org.budgetanalyzer.finance.engine.CurrencyRegistry;
import org.budgetanalyzer.finance.engine.RateMap;
import org.budgetanalyzer.finance.exception.ServiceUnavailableException;
import org.budgetanalyzer.finance.service.rate.RateBatchResolver;
import org.budgetanalyzer.finance.service.rate.RateBatchResult;

/**
 * Service for querying exchange rates and converting single amounts.
 *
 * <p>Rates are always quoted from the base reporting currency. A date without a published rate
 * uses the latest earlier one.
 */
@Service
public class ExchangeRateService {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateService.class);

  private final RateBatchResolver rateBatchResolver;
  private final CurrencyService currencyService;
  private final CurrencyConverter currencyConverter;
  private final String baseCurrency;
  private final Clock clock;

  public ExchangeRateService(
      RateBatchResolver rateBatchResolver,
      CurrencyService currencyService,
      CurrencyConverter currencyConverter,
      FinanceServiceProperties properties,
      Clock clock) {
    this.rateBatchResolver = rateBatchResolver;
    this.currencyService = currencyService;
    this.currencyConverter = currencyConverter;
    this.baseCurrency = properties.getCurrency().getBaseReportingCurrency();
    this.clock = clock;
  }

  public String getBaseCurrency() {
    return baseCurrency;
  }

  /**
   * Resolves rates from the base currency.
   *
   * @param date rate date, {@code null} for today
   * @param targetCurrencies target codes, {@code null} or empty for all active currencies
   * @return resolved rates; currencies without a rate are omitted
   * @throws ServiceUnavailableException if no rate could be resolved because the store failed
   */
  public RateBatchResult getRates(LocalDate date, Collection<String> targetCurrencies) {
    var rateDate = date != null ? date : LocalDate.now(clock);
    var targets =
        targetCurrencies != null && !targetCurrencies.isEmpty()
            ? targetCurrencies
            : currencyService.getCurrencies(true).stream().map(CurrencyInfo::code).toList();

    log.info("Resolving exchange rates for {} on {}", targets, rateDate);

    var result = rateBatchResolver.resolveMany(rateDate, targets, baseCurrency);
    if (result.hasError()) {
      throw new ServiceUnavailableException(
          "Exchange rates are unavailable for " + rateDate + ": " + result.error().get().message(),
          FinanceServiceError.EXCHANGE_RATES_UNAVAILABLE.name());
    }
    return result;
  }

  /**
   * Converts an amount between two currencies.
   *
   * <p>Only the rates of the two currencies are resolved, and none when they are equal or both
   * the base currency.
   *
   * @param amount amount in the source currency
   * @param sourceCurrency source currency code
   * @param targetCurrency target currency code
   * @param date rate date, {@code null} for today
   * @return the conversion result, which may be degraded or a fallback
   * @throws ServiceUnavailableException if a needed rate could not be looked up because the store
   *     failed
   */
  public ConversionResult convert(
      double amount, String sourceCurrency, String targetCurrency, LocalDate date) {
    var rateDate = date != null ? date : LocalDate.now(clock);
    var registry = CurrencyRegistry.of(currencyService.getCurrencies(false));

    var rates = RateMap.empty();
    var needed =
        Stream.of(sourceCurrency, targetCurrency)
            .filter(code -> !code.equals(baseCurrency))
            .distinct()
            .toList();
    if (!sourceCurrency.equals(targetCurrency) && !needed.isEmpty()) {
      rates = getRates(rateDate, needed).rates();
    }

    var context = new ConversionContext(registry, rates, baseCurrency, targetCurrency);
    return currencyConverter.convert(amount, sourceCurrency, context);
  }
}
