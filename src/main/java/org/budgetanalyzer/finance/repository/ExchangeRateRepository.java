package org.budgetanalyzer.finance.repository;

import java.time.LocalDate;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.ExchangeRate;

public interface ExchangeRateRepository extends JpaRepository<ExchangeRate, Long> {

  /**
   * Finds the most recent rate for a currency pair published on or before the given date.
   *
   * <p>Rates are not published on weekends and holidays, so the latest earlier rate stands in for
   * those dates.
   *
   * @param baseCurrencyCode the base currency code
   * @param targetCurrencyCode the target currency code
   * @param date the requested date (inclusive upper bound)
   * @return the latest rate on or before {@code date}, if any
   */
  Optional<ExchangeRate>
      findTopByBaseCurrencyCodeAndTargetCurrencyCodeAndRateDateLessThanEqualOrderByRateDateDesc(
          String baseCurrencyCode, String targetCurrencyCode, LocalDate date);
}
