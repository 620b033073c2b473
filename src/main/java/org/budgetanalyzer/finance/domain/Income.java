package org.budgetanalyzer.finance.domain;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "incomes")
public class Income extends AuditableEntity implements MonetaryRecord {

  @Id private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "source_name", nullable = false)
  private String sourceName;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "is_recurring", nullable = false)
  private boolean recurring;

  @Embedded private Money amount;

  protected Income() {}

  public Income(
      UUID id,
      UUID userId,
      String sourceName,
      LocalDate startDate,
      boolean recurring,
      Money amount) {
    this.id = id;
    this.userId = userId;
    this.sourceName = sourceName;
    this.startDate = startDate;
    this.recurring = recurring;
    this.amount = amount;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getSourceName() {
    return sourceName;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public boolean isRecurring() {
    return recurring;
  }

  @Override
  public Money getAmount() {
    return amount;
  }
}
