package org.budgetanalyzer.finance.engine;

/**
 * Read-only reference data for converting and rendering the amounts of one request.
 *
 * @param registry currency metadata
 * @param rates rates from the base currency
 * @param baseCurrency code in which stored reporting amounts are expressed
 * @param displayCurrency code in which amounts are rendered
 */
public record ConversionContext(
    CurrencyRegistry registry, RateMap rates, String baseCurrency, String displayCurrency) {}
