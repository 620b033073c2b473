package org.budgetanalyzer.finance.service.rate;

import java.time.LocalDate;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import org.budgetanalyzer.finance.config.FinanceServiceProperties;
import org.budgetanalyzer.finance.domain.ExchangeRate;
import org.budgetanalyzer.finance.repository.ExchangeRateRepository;

/**
 * {@link RateLookup} over the {@code exchange_rates} table.
 *
 * <p>The table only holds rates from the base reporting currency. For a given date the latest rate
 * on or before that date is used, which carries the last published rate across weekends and
 * holidays. Rates between two non-base currencies are derived from their base legs:
 *
 * <ul>
 *   <li>base to X: the stored rate
 *   <li>X to base: {@code 1 / rate(X)}
 *   <li>X to Y: {@code rate(Y) / rate(X)}
 * </ul>
 *
 * <p>A missing or zero leg makes the whole pair absent.
 */
@Component
@Transactional(readOnly = true)
public class StoredExchangeRateLookup implements RateLookup {

  private static final Logger log = LoggerFactory.getLogger(StoredExchangeRateLookup.class);

  private final ExchangeRateRepository exchangeRateRepository;
  private final String baseCurrency;

  public StoredExchangeRateLookup(
      ExchangeRateRepository exchangeRateRepository, FinanceServiceProperties properties) {
    this.exchangeRateRepository = exchangeRateRepository;
    this.baseCurrency = properties.getCurrency().getBaseReportingCurrency();
  }

  @Override
  public OptionalDouble lookupRate(LocalDate date, String sourceCurrency, String targetCurrency) {
    if (sourceCurrency.equals(targetCurrency)) {
      return OptionalDouble.of(1.0);
    }

    try {
      if (sourceCurrency.equals(baseCurrency)) {
        return baseLeg(date, targetCurrency);
      }

      var sourceLeg = baseLeg(date, sourceCurrency);
      if (sourceLeg.isEmpty()) {
        return OptionalDouble.empty();
      }

      if (targetCurrency.equals(baseCurrency)) {
        return OptionalDouble.of(1.0 / sourceLeg.getAsDouble());
      }

      var targetLeg = baseLeg(date, targetCurrency);
      if (targetLeg.isEmpty()) {
        return OptionalDouble.empty();
      }

      var crossRate = targetLeg.getAsDouble() / sourceLeg.getAsDouble();
      log.debug(
          "Derived cross rate {} -> {} on {}: {}", sourceCurrency, targetCurrency, date, crossRate);
      return OptionalDouble.of(crossRate);
    } catch (DataAccessException e) {
      throw new RateLookupException(
          "Exchange rate store unavailable for " + sourceCurrency + " -> " + targetCurrency, e);
    }
  }

  private OptionalDouble baseLeg(LocalDate date, String currency) {
    var latest =
        exchangeRateRepository
            .findTopByBaseCurrencyCodeAndTargetCurrencyCodeAndRateDateLessThanEqualOrderByRateDateDesc(
                baseCurrency, currency, date)
            .map(ExchangeRate::getRate);

    if (latest.isEmpty() || latest.get() == 0.0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(latest.get());
  }
}
