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
 * Spending limit for one category over one period.
 *
 * <p>Currency, category and period are fixed at creation. The reporting-currency limit is a
 * snapshot taken when the limit was last written; it is not refreshed when rates move.
 *
 * <p>{@code periodStartDate} is kept as the ISO text delivered by the store ({@code yyyy-MM-dd}).
 * Rows with an unparsable value are reported as malformed by the calculator instead of failing the
 * whole batch.
 */
@Entity
@Table(name = "budgets")
public class Budget extends AuditableEntity {

  /** The only supported period type. */
  public static final String PERIOD_TYPE_MONTHLY = "monthly";

  @Id private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false)
  private String category;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(name = "nativeAmount", column = @Column(name = "amount_limit_native")),
    @AttributeOverride(
        name = "reportingAmount",
        column = @Column(name = "amount_limit_reporting_currency"))
  })
  private Money limit;

  @Column(name = "period_type", nullable = false)
  private String periodType = PERIOD_TYPE_MONTHLY;

  @Column(name = "period_start_date", nullable = false, length = 10)
  private String periodStartDate;

  protected Budget() {}

  public Budget(UUID id, UUID userId, String category, Money limit, String periodStartDate) {
    this.id = id;
    this.userId = userId;
    this.category = category;
    this.limit = limit;
    this.periodStartDate = periodStartDate;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getCategory() {
    return category;
  }

  public Money getLimit() {
    return limit;
  }

  public String getPeriodType() {
    return periodType;
  }

  public String getPeriodStartDate() {
    return periodStartDate;
  }
}
