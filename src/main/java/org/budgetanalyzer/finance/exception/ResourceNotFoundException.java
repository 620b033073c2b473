package org.budgetanalyzer.finance.exception;

/** A requested resource does not exist. The code, when present, names what was missing. */
public class ResourceNotFoundException extends ServiceException {

  private final String code;

  public ResourceNotFoundException(String message) {
    this(message, null);
  }

  public ResourceNotFoundException(String message, String code) {
    super(message);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
