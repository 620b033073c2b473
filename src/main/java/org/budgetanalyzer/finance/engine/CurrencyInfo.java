package org.budgetanalyzer.finance.engine;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

import org.budgetanalyzer.finance.domain.Currency;

/**
 * Display metadata of one currency.
 *
 * <p>Carries explicit type information so lists of it survive the JSON round trip through the
 * Redis cache.
 *
 * @param code ISO 4217 code
 * @param name display name
 * @param symbol display symbol, may be blank
 * @param decimalDigits number of fraction digits rendered
 * @param active whether the currency can be chosen for new records
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.CLASS)
public record CurrencyInfo(
    String code, String name, String symbol, int decimalDigits, boolean active) {

  public static CurrencyInfo from(Currency currency) {
    return new CurrencyInfo(
        currency.getCode(),
        currency.getName(),
        currency.getSymbol(),
        currency.getDecimalDigits(),
        currency.isActive());
  }
}
