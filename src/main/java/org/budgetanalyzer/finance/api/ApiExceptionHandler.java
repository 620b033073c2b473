package org.budgetanalyzer.finance.api;

import jakarta.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.budgetanalyzer.finance.exception.BusinessException;
import org.budgetanalyzer.finance.exception.InvalidRequestException;
import org.budgetanalyzer.finance.exception.ResourceNotFoundException;
import org.budgetanalyzer.finance.exception.ServiceUnavailableException;

/**
 * Maps exceptions to {@link ApiErrorResponse} bodies.
 *
 * <ul>
 *   <li>{@link InvalidRequestException}, validation and parameter errors: 400
 *   <li>{@link ResourceNotFoundException}: 404
 *   <li>{@link BusinessException}: 422
 *   <li>{@link ServiceUnavailableException}: 503
 *   <li>anything else: 500 with a generic message
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidRequestException e) {
    log.warn("Invalid request: {}", e.getMessage());
    return build(
        HttpStatus.BAD_REQUEST, ApiErrorResponse.of(ApiErrorType.INVALID_REQUEST, e.getMessage()));
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    ConstraintViolationException.class,
    HandlerMethodValidationException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiErrorResponse> handleValidation(Exception e) {
    log.warn("Request validation failed: {}", e.getMessage());
    return build(
        HttpStatus.BAD_REQUEST, ApiErrorResponse.of(ApiErrorType.VALIDATION_ERROR, e.getMessage()));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException e) {
    var message = "Invalid value '" + e.getValue() + "' for parameter '" + e.getName() + "'";
    log.warn(message);
    return build(
        HttpStatus.BAD_REQUEST, ApiErrorResponse.of(ApiErrorType.INVALID_REQUEST, message));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ResourceNotFoundException e) {
    log.warn("Resource not found: {}", e.getMessage());
    return build(
        HttpStatus.NOT_FOUND,
        ApiErrorResponse.of(ApiErrorType.NOT_FOUND, e.getMessage(), e.getCode()));
  }

  @ExceptionHandler(BusinessException.class)
  public ResponseEntity<ApiErrorResponse> handleBusiness(BusinessException e) {
    log.warn("Business rule violated [{}]: {}", e.getCode(), e.getMessage());
    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ApiErrorResponse.of(ApiErrorType.APPLICATION_ERROR, e.getMessage(), e.getCode()));
  }

  @ExceptionHandler(ServiceUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleServiceUnavailable(ServiceUnavailableException e) {
    log.error("Service unavailable [{}]: {}", e.getCode(), e.getMessage(), e);
    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiErrorResponse.of(ApiErrorType.SERVICE_UNAVAILABLE, e.getMessage(), e.getCode()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception e) {
    log.error("Unexpected error: {}", e.getMessage(), e);
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiErrorResponse.of(ApiErrorType.INTERNAL_ERROR, "An unexpected error occurred"));
  }

  private static ResponseEntity<ApiErrorResponse> build(HttpStatus status, ApiErrorResponse body) {
    return ResponseEntity.status(status).body(body);
  }
}
