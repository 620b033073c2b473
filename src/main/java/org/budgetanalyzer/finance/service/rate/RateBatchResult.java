package org.budgetanalyzer.finance.service.rate;

import java.time.LocalDate;
import java.util.Optional;

import org.budgetanalyzer.finance.engine.RateMap;

/**
 * Rates resolved for a batch of target currencies.
 *
 * @param date rate date
 * @param rates resolved rates from the base currency, possibly partial
 * @param error present only when no non-base currency resolved and a lookup failed in transport
 */
public record RateBatchResult(LocalDate date, RateMap rates, Optional<RateFailure> error) {

  public boolean hasError() {
    return error.isPresent();
  }
}
