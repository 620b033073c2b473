package org.budgetanalyzer.finance.engine;

/** How a conversion arrived at its displayed text. */
public enum ConversionOutcome {
  /** Converted and formatted with the target currency's metadata. */
  CONVERTED,

  /** Target currency metadata missing: the unconverted amount is shown with a marker. */
  DEGRADED,

  /** No usable value: the configured fallback text is shown. */
  FALLBACK
}
