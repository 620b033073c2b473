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
@Table(name = "debts")
public class Debt extends AuditableEntity implements MonetaryRecord {

  @Id private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false)
  private String creditor;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(name = "nativeAmount", column = @Column(name = "current_balance_native")),
    @AttributeOverride(
        name = "reportingAmount",
        column = @Column(name = "current_balance_reporting_currency"))
  })
  private Money currentBalance;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "is_paid", nullable = false)
  private boolean paid;

  protected Debt() {}

  public Debt(
      UUID id,
      UUID userId,
      String creditor,
      Money currentBalance,
      LocalDate dueDate,
      boolean paid) {
    this.id = id;
    this.userId = userId;
    this.creditor = creditor;
    this.currentBalance = currentBalance;
    this.dueDate = dueDate;
    this.paid = paid;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getCreditor() {
    return creditor;
  }

  /** Current outstanding balance. */
  @Override
  public Money getAmount() {
    return currentBalance;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public boolean isPaid() {
    return paid;
  }
}
