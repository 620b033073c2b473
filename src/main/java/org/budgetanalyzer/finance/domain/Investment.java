package org.budgetanalyzer.finance.domain;

import java.util.UUID;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Investment position.
 *
 * <p>Both valuation amounts may be absent until the position has been priced; an absent current
 * value contributes zero to totals.
 */
@Entity
@Table(name = "investments")
public class Investment extends AuditableEntity implements MonetaryRecord {

  @Id private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false)
  private String name;

  @Column(nullable = false)
  private String type;

  private Double quantity;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(
        name = "nativeAmount",
        column = @Column(name = "total_current_value_native")),
    @AttributeOverride(name = "nativeCurrencyCode", column = @Column(name = "currency_code")),
    @AttributeOverride(
        name = "reportingAmount",
        column = @Column(name = "total_current_value_reporting_currency"))
  })
  private Money currentValue;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(
        name = "nativeAmount",
        column = @Column(name = "total_initial_cost_native")),
    @AttributeOverride(
        name = "nativeCurrencyCode",
        column = @Column(name = "currency_code", insertable = false, updatable = false)),
    @AttributeOverride(
        name = "reportingAmount",
        column = @Column(name = "total_initial_cost_reporting_currency"))
  })
  private Money initialCost;

  protected Investment() {}

  public Investment(
      UUID id,
      UUID userId,
      String name,
      String type,
      Double quantity,
      Money currentValue,
      Money initialCost) {
    this.id = id;
    this.userId = userId;
    this.name = name;
    this.type = type;
    this.quantity = quantity;
    this.currentValue = currentValue;
    this.initialCost = initialCost;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public Double getQuantity() {
    return quantity;
  }

  /** Total current value of the position. */
  @Override
  public Money getAmount() {
    return currentValue;
  }

  public Money getInitialCost() {
    return initialCost;
  }
}
