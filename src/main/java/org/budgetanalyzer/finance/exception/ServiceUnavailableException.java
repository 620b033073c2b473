package org.budgetanalyzer.finance.exception;

/**
 * Critical reference data or a backing store is unavailable.
 *
 * <p>Raised when no meaningful amount could be displayed at all, for example when no currency
 * metadata exists or no exchange rate could be resolved.
 */
public class ServiceUnavailableException extends ServiceException {

  private final String code;

  public ServiceUnavailableException(String message, String code) {
    super(message);
    this.code = code;
  }

  public ServiceUnavailableException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
