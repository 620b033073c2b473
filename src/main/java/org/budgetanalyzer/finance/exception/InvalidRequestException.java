package org.budgetanalyzer.finance.exception;

/** Request is syntactically valid but its parameters are inconsistent. */
public class InvalidRequestException extends ServiceException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
