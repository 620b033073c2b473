package org.budgetanalyzer.finance.service.rate;

import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * Read access to stored exchange rates.
 *
 * <p>Implementations never retry and never backfill; staleness is owned by whatever populates the
 * store.
 */
public interface RateLookup {

  /**
   * Looks up how many units of {@code targetCurrency} one unit of {@code sourceCurrency} buys on
   * a date.
   *
   * @param date rate date
   * @param sourceCurrency ISO 4217 code of the source currency
   * @param targetCurrency ISO 4217 code of the target currency
   * @return the stored rate, or empty when none exists for the pair and date
   * @throws RateLookupException if the store cannot be queried
   */
  OptionalDouble lookupRate(LocalDate date, String sourceCurrency, String targetCurrency)
      throws RateLookupException;
}
