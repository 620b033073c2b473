package org.budgetanalyzer.finance.domain;

import java.util.UUID;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "accounts")
public class Account extends AuditableEntity implements MonetaryRecord {

  @Id private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false)
  private String name;

  /** One of {@code cash}, {@code bank_account}, {@code e-wallet}. */
  @Column(nullable = false)
  private String type;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(name = "nativeAmount", column = @Column(name = "balance_native")),
    @AttributeOverride(name = "nativeCurrencyCode", column = @Column(name = "native_currency_code")),
    @AttributeOverride(
        name = "reportingAmount",
        column = @Column(name = "balance_reporting_currency"))
  })
  private Money balance;

  protected Account() {}

  public Account(UUID id, UUID userId, String name, String type, Money balance) {
    this.id = id;
    this.userId = userId;
    this.name = name;
    this.type = type;
    this.balance = balance;
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

  @Override
  public Money getAmount() {
    return balance;
  }
}
