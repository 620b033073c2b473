package org.budgetanalyzer.finance.service.rate;

import org.budgetanalyzer.finance.service.FinanceServiceError;

/**
 * A rate that could not be resolved.
 *
 * @param currency target currency of the failed lookup
 * @param error failure kind
 * @param message human readable detail
 */
public record RateFailure(String currency, FinanceServiceError error, String message) {}
