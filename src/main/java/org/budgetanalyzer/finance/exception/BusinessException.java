package org.budgetanalyzer.finance.exception;

/** Business rule violation, reported with a machine-readable error code. */
public class BusinessException extends ServiceException {

  private final String code;

  public BusinessException(String message, String code) {
    super(message);
    this.code = code;
  }

  public BusinessException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
