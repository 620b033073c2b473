package org.budgetanalyzer.finance.service.rate;

import org.budgetanalyzer.finance.exception.ServiceException;

/** Thrown when the exchange rate store cannot be queried. Distinct from a rate not existing. */
public class RateLookupException extends ServiceException {

  public RateLookupException(String message) {
    super(message);
  }

  public RateLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
