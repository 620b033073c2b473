package org.budgetanalyzer.finance.domain;

import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * A monetary value in its native currency together with its reporting-currency equivalent.
 *
 * <p>The reporting amount is computed once by the external write path, using the rate in effect on
 * the record's date, and is frozen from then on. This type exposes no mutators: aggregation code
 * sums {@link #getReportingAmount()} and never re-derives it from the native amount and a live
 * rate.
 *
 * <p>The reporting amount is only ever null for values that have not been assessed yet, such as an
 * investment without a current valuation.
 */
@Embeddable
public class Money {

  @Column(name = "amount_native")
  private Double nativeAmount;

  @Column(name = "currency_code", length = 3)
  private String nativeCurrencyCode;

  @Column(name = "amount_reporting_currency")
  private Double reportingAmount;

  protected Money() {}

  public Money(Double nativeAmount, String nativeCurrencyCode, Double reportingAmount) {
    this.nativeAmount = nativeAmount;
    this.nativeCurrencyCode = nativeCurrencyCode;
    this.reportingAmount = reportingAmount;
  }

  public static Money of(double nativeAmount, String nativeCurrencyCode, double reportingAmount) {
    return new Money(nativeAmount, nativeCurrencyCode, reportingAmount);
  }

  public Double getNativeAmount() {
    return nativeAmount;
  }

  public String getNativeCurrencyCode() {
    return nativeCurrencyCode;
  }

  public Double getReportingAmount() {
    return reportingAmount;
  }

  /** Reporting amount, with an absent value counting as zero. */
  public double reportingOrZero() {
    return reportingAmount != null ? reportingAmount : 0.0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Money other)) {
      return false;
    }
    return Objects.equals(nativeAmount, other.nativeAmount)
        && Objects.equals(nativeCurrencyCode, other.nativeCurrencyCode)
        && Objects.equals(reportingAmount, other.reportingAmount);
  }

  @Override
  public int hashCode() {
    return Objects.hash(nativeAmount, nativeCurrencyCode, reportingAmount);
  }

  @Override
  public String toString() {
    return nativeAmount + " " + nativeCurrencyCode + " (reporting: " + reportingAmount + ")";
  }
}
