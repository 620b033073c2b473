package org.budgetanalyzer.finance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Currency metadata.
 *
 * <p>{@code decimalDigits} governs rounding and display for amounts in this currency. Rows are
 * maintained outside this service and are treated as immutable once referenced by a record.
 */
@Entity
@Table(name = "currencies")
public class Currency extends AuditableEntity {

  /** ISO 4217-like currency code. */
  @Id
  @Column(length = 3)
  private String code;

  @Column(nullable = false)
  private String name;

  @Column(nullable = false)
  private String symbol;

  @Column(name = "decimal_digits", nullable = false)
  private int decimalDigits;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  protected Currency() {}

  public Currency(String code, String name, String symbol, int decimalDigits, boolean active) {
    this.code = code;
    this.name = name;
    this.symbol = symbol;
    this.decimalDigits = decimalDigits;
    this.active = active;
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public String getSymbol() {
    return symbol;
  }

  public int getDecimalDigits() {
    return decimalDigits;
  }

  public boolean isActive() {
    return active;
  }
}
