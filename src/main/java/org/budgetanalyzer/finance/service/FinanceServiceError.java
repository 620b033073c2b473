package org.budgetanalyzer.finance.service;

/** Error codes for finance service results and exceptions. */
public enum FinanceServiceError {
  /** A rate or a currency does not exist in the store. */
  NOT_FOUND,

  /** A stored rate is zero, negative or not a finite number. Handled like {@link #NOT_FOUND}. */
  ZERO_OR_INVALID_RATE,

  /** A record carries data that cannot be interpreted, such as an unparsable period date. */
  MALFORMED_RECORD,

  /** The backing store could not be reached or the query failed. */
  TRANSPORT_FAILURE,

  /** No currency metadata is available, so no amount can be rendered. */
  CURRENCY_METADATA_UNAVAILABLE,

  /** Not a single exchange rate could be resolved for the request. */
  EXCHANGE_RATES_UNAVAILABLE,

  /** The requested user profile does not exist. */
  USER_NOT_FOUND,

  /** A budget period start is not the first day of a month. */
  INVALID_PERIOD_START,
}
