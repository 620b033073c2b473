package org.budgetanalyzer.finance.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.budgetanalyzer.finance.config.FinanceServiceProperties;

/**
 * Converts amounts between currencies through the base reporting currency and renders them for
 * display.
 *
 * <p>Conversion takes two hops: the source amount is divided by the base-to-source rate, then
 * multiplied by the base-to-target rate. A hop is skipped when its side is the base currency, and
 * no rate is needed at all when source and target are equal.
 *
 * <p>Conversion never throws. Whenever a value cannot be produced the result carries the
 * configured fallback text, and the {@code currency.conversion.degraded} counter is incremented
 * with the reason.
 */
@Component
public class CurrencyConverter {

  private static final Logger log = LoggerFactory.getLogger(CurrencyConverter.class);

  static final String DEGRADED_METRIC = "currency.conversion.degraded";

  private final MeterRegistry meterRegistry;
  private final String baseCurrency;
  private final String fallbackDisplay;
  private final Locale displayLocale;

  public CurrencyConverter(FinanceServiceProperties properties, MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    var currency = properties.getCurrency();
    this.baseCurrency = currency.getBaseReportingCurrency();
    this.fallbackDisplay = currency.getFallbackDisplay();
    this.displayLocale = Locale.forLanguageTag(currency.getDisplayLocale());
  }

  /**
   * Converts an amount into the context's display currency.
   *
   * @param amount amount in the source currency, may be {@code null}
   * @param sourceCurrency currency of the amount
   * @param context conversion reference data of the current request
   * @return the conversion result
   */
  public ConversionResult convert(Double amount, String sourceCurrency, ConversionContext context) {
    return convert(
        amount,
        sourceCurrency,
        context.displayCurrency(),
        context.registry(),
        context.rates(),
        context.baseCurrency());
  }

  /**
   * Converts an amount between two currencies using the configured base reporting currency.
   *
   * @param amount amount in the source currency, may be {@code null}
   * @param sourceCurrency currency of the amount
   * @param targetCurrency currency to convert into
   * @param registry currency metadata
   * @param rates rates from the base currency
   * @return the conversion result
   */
  public ConversionResult convert(
      Double amount,
      String sourceCurrency,
      String targetCurrency,
      CurrencyRegistry registry,
      RateMap rates) {
    return convert(amount, sourceCurrency, targetCurrency, registry, rates, baseCurrency);
  }

  /**
   * Renders an amount in the context's display currency.
   *
   * @param amount amount in the source currency, may be {@code null}
   * @param sourceCurrency currency of the amount
   * @param context conversion reference data of the current request
   * @return display text, never {@code null}
   */
  public String format(Double amount, String sourceCurrency, ConversionContext context) {
    return convert(amount, sourceCurrency, context).formatted();
  }

  /**
   * Renders an amount in a target currency.
   *
   * @param amount amount in the source currency, may be {@code null}
   * @param sourceCurrency currency of the amount
   * @param targetCurrency currency to render in
   * @param registry currency metadata
   * @param rates rates from the base currency
   * @return display text, never {@code null}
   */
  public String format(
      Double amount,
      String sourceCurrency,
      String targetCurrency,
      CurrencyRegistry registry,
      RateMap rates) {
    return convert(amount, sourceCurrency, targetCurrency, registry, rates).formatted();
  }

  private ConversionResult convert(
      Double amount,
      String sourceCurrency,
      String targetCurrency,
      CurrencyRegistry registry,
      RateMap rates,
      String base) {
    if (amount == null || amount.isNaN()) {
      return fallback("missing_amount");
    }

    var targetInfo =
        registry != null ? registry.find(targetCurrency) : Optional.<CurrencyInfo>empty();
    if (targetInfo.isEmpty()) {
      log.warn("No currency metadata for target currency: {}", targetCurrency);
      recordDegraded("missing_target_metadata");
      var text = String.format(Locale.ROOT, "%.2f %s (Info?)", amount, targetCurrency);
      return ConversionResult.degraded(amount, text);
    }

    var effectiveRates = rates != null ? rates : RateMap.empty();
    double converted = amount;

    if (!sameCode(sourceCurrency, targetCurrency)) {
      double inBase;
      if (sameCode(sourceCurrency, base)) {
        inBase = amount;
      } else {
        var sourceRate = effectiveRates.get(sourceCurrency);
        if (sourceRate.isEmpty() || sourceRate.getAsDouble() == 0.0) {
          log.warn(
              "Missing or zero exchange rate {} -> {}, cannot convert {} to {}",
              base,
              sourceCurrency,
              sourceCurrency,
              targetCurrency);
          return fallback("missing_source_rate");
        }
        inBase = amount / sourceRate.getAsDouble();
      }

      if (sameCode(targetCurrency, base)) {
        converted = inBase;
      } else {
        var targetRate = effectiveRates.get(targetCurrency);
        if (targetRate.isEmpty()) {
          log.warn(
              "Missing exchange rate {} -> {}, cannot convert {} to {}",
              base,
              targetCurrency,
              sourceCurrency,
              targetCurrency);
          return fallback("missing_target_rate");
        }
        converted = inBase * targetRate.getAsDouble();
      }
    }

    if (Double.isNaN(converted)) {
      log.warn("Conversion of {} {} to {} produced NaN", amount, sourceCurrency, targetCurrency);
      return fallback("not_a_number");
    }

    return ConversionResult.converted(converted, render(converted, targetInfo.get()));
  }

  private String render(double value, CurrencyInfo info) {
    var digits = Math.max(0, info.decimalDigits());
    try {
      var currency = java.util.Currency.getInstance(info.code());
      var numberFormat = NumberFormat.getCurrencyInstance(displayLocale);
      numberFormat.setCurrency(currency);
      numberFormat.setMinimumFractionDigits(digits);
      numberFormat.setMaximumFractionDigits(digits);
      numberFormat.setRoundingMode(RoundingMode.HALF_UP);
      numberFormat.setGroupingUsed(true);
      return numberFormat.format(value);
    } catch (IllegalArgumentException e) {
      log.warn("Locale formatting unavailable for currency {}: {}", info.code(), e.getMessage());
      recordDegraded("format_error");
      return plainFormat(value, digits, info);
    }
  }

  private static String plainFormat(double value, int digits, CurrencyInfo info) {
    var label = info.symbol() != null && !info.symbol().isBlank() ? info.symbol() : info.code();
    if (Double.isInfinite(value)) {
      return value + " " + label;
    }
    var fixed = BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).toPlainString();
    return fixed + " " + label;
  }

  private ConversionResult fallback(String reason) {
    recordDegraded(reason);
    return ConversionResult.fallback(fallbackDisplay);
  }

  private void recordDegraded(String reason) {
    Counter.builder(DEGRADED_METRIC)
        .description("Conversions rendered without a converted value or locale formatting")
        .tag("reason", reason)
        .register(meterRegistry)
        .increment();
  }

  private static boolean sameCode(String left, String right) {
    return left != null && left.equals(right);
  }
}
