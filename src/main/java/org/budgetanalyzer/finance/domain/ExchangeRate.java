package org.budgetanalyzer.finance.domain;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Daily exchange rate populated by the external rate import process.
 *
 * <p>A row means "1 unit of {@code baseCurrencyCode} = {@code rate} units of {@code
 * targetCurrencyCode}". Only rates from the base reporting currency are stored; cross rates between
 * two other currencies are derived at lookup time.
 */
@Entity
@Table(
    name = "exchange_rates",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"rate_date", "base_currency_code", "target_currency_code"}))
public class ExchangeRate {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "rate_date", nullable = false)
  private LocalDate rateDate;

  @Column(name = "base_currency_code", nullable = false, length = 3)
  private String baseCurrencyCode;

  @Column(name = "target_currency_code", nullable = false, length = 3)
  private String targetCurrencyCode;

  @Column(nullable = false)
  private double rate;

  protected ExchangeRate() {}

  public ExchangeRate(
      LocalDate rateDate, String baseCurrencyCode, String targetCurrencyCode, double rate) {
    this.rateDate = rateDate;
    this.baseCurrencyCode = baseCurrencyCode;
    this.targetCurrencyCode = targetCurrencyCode;
    this.rate = rate;
  }

  public Long getId() {
    return id;
  }

  public LocalDate getRateDate() {
    return rateDate;
  }

  public String getBaseCurrencyCode() {
    return baseCurrencyCode;
  }

  public String getTargetCurrencyCode() {
    return targetCurrencyCode;
  }

  public double getRate() {
    return rate;
  }
}
