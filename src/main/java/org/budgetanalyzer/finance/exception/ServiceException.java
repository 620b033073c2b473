package org.budgetanalyzer.finance.exception;

/**
 * Base class for exceptions raised at the service boundary.
 *
 * <p>Engine components never throw these for data-quality problems; they return typed results
 * instead. Only request validation and resource unavailability surface as a {@code
 * ServiceException}.
 */
public abstract class ServiceException extends RuntimeException {

  protected ServiceException(String message) {
    super(message);
  }

  protected ServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
