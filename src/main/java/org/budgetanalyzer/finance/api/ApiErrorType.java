package org.budgetanalyzer.finance.api;

/** Category of an API error, reported as {@code type} in error responses. */
public enum ApiErrorType {
  INVALID_REQUEST,
  VALIDATION_ERROR,
  NOT_FOUND,
  APPLICATION_ERROR,
  SERVICE_UNAVAILABLE,
  INTERNAL_ERROR
}
