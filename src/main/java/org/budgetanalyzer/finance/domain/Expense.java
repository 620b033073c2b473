package org.budgetanalyzer.finance.domain;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "expenses")
public class Expense extends AuditableEntity implements MonetaryRecord {

  @Id private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  /** Category slug, matched case-insensitively against budget categories. */
  @Column(nullable = false)
  private String category;

  @Column(name = "expense_date", nullable = false)
  private LocalDate date;

  private String description;

  @Embedded private Money amount;

  protected Expense() {}

  public Expense(
      UUID id, UUID userId, String category, LocalDate date, String description, Money amount) {
    this.id = id;
    this.userId = userId;
    this.category = category;
    this.date = date;
    this.description = description;
    this.amount = amount;
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

  public LocalDate getDate() {
    return date;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public Money getAmount() {
    return amount;
  }
}
