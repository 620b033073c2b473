package org.budgetanalyzer.finance.engine;

/**
 * Result of converting one amount into a display currency.
 *
 * @param value converted amount, {@code null} for {@link ConversionOutcome#FALLBACK}
 * @param formatted text to display, never {@code null}
 * @param outcome how the result was produced
 */
public record ConversionResult(Double value, String formatted, ConversionOutcome outcome) {

  public static ConversionResult converted(double value, String formatted) {
    return new ConversionResult(value, formatted, ConversionOutcome.CONVERTED);
  }

  public static ConversionResult degraded(double value, String formatted) {
    return new ConversionResult(value, formatted, ConversionOutcome.DEGRADED);
  }

  public static ConversionResult fallback(String formatted) {
    return new ConversionResult(null, formatted, ConversionOutcome.FALLBACK);
  }

  public boolean isConverted() {
    return outcome == ConversionOutcome.CONVERTED;
  }
}
