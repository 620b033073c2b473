package org.budgetanalyzer.finance.service.rate;

import java.util.Locale;
import java.util.OptionalDouble;

import org.budgetanalyzer.finance.service.FinanceServiceError;

/**
 * Outcome of resolving a single exchange rate.
 *
 * <p>Exactly one of {@code rate} and {@code error} is set.
 *
 * @param sourceCurrency source currency code
 * @param targetCurrency target currency code
 * @param rate resolved rate, {@code null} unless found
 * @param error failure kind, {@code null} when found
 * @param message failure detail, {@code null} when found
 */
public record RateResolution(
    String sourceCurrency,
    String targetCurrency,
    Double rate,
    FinanceServiceError error,
    String message) {

  public static RateResolution found(String source, String target, double rate) {
    return new RateResolution(source, target, rate, null, null);
  }

  public static RateResolution notFound(String source, String target, String message) {
    return new RateResolution(source, target, null, FinanceServiceError.NOT_FOUND, message);
  }

  public static RateResolution invalidRate(String source, String target, String message) {
    return new RateResolution(
        source, target, null, FinanceServiceError.ZERO_OR_INVALID_RATE, message);
  }

  public static RateResolution transportFailure(String source, String target, String message) {
    return new RateResolution(
        source, target, null, FinanceServiceError.TRANSPORT_FAILURE, message);
  }

  public boolean isFound() {
    return error == null;
  }

  /** Whether the store could not be queried, as opposed to having no usable rate. */
  public boolean isTransportFailure() {
    return error == FinanceServiceError.TRANSPORT_FAILURE;
  }

  public OptionalDouble asOptional() {
    return rate != null ? OptionalDouble.of(rate) : OptionalDouble.empty();
  }

  /** Metric tag value of this outcome. */
  String outcomeTag() {
    return isFound() ? "found" : error.name().toLowerCase(Locale.ROOT);
  }

  public RateFailure toFailure() {
    if (isFound()) {
      throw new IllegalStateException(
          "Rate resolved for " + sourceCurrency + " -> " + targetCurrency);
    }
    return new RateFailure(targetCurrency, error, message);
  }
}
