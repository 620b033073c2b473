package org.budgetanalyzer.finance.domain;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "financial_goals")
public class FinancialGoal extends AuditableEntity {

  @Id private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false)
  private String name;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(name = "nativeAmount", column = @Column(name = "target_amount_native")),
    @AttributeOverride(
        name = "reportingAmount",
        column = @Column(name = "target_amount_reporting_currency"))
  })
  private Money target;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(
        name = "nativeAmount",
        column = @Column(name = "current_amount_saved_native")),
    @AttributeOverride(
        name = "nativeCurrencyCode",
        column = @Column(name = "currency_code", insertable = false, updatable = false)),
    @AttributeOverride(
        name = "reportingAmount",
        column = @Column(name = "current_amount_saved_reporting_currency"))
  })
  private Money saved;

  @Column(name = "target_date")
  private LocalDate targetDate;

  /** One of {@code active}, {@code achieved}, {@code paused}, {@code cancelled}. */
  @Column(nullable = false)
  private String status;

  protected FinancialGoal() {}

  public FinancialGoal(
      UUID id,
      UUID userId,
      String name,
      Money target,
      Money saved,
      LocalDate targetDate,
      String status) {
    this.id = id;
    this.userId = userId;
    this.name = name;
    this.target = target;
    this.saved = saved;
    this.targetDate = targetDate;
    this.status = status;
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

  public Money getTarget() {
    return target;
  }

  public Money getSaved() {
    return saved;
  }

  public LocalDate getTargetDate() {
    return targetDate;
  }

  public String getStatus() {
    return status;
  }
}
