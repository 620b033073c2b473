package org.budgetanalyzer.finance.domain;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/** User profile holding the preferred display currency. */
@Entity
@Table(name = "profiles")
public class UserProfile extends AuditableEntity {

  @Id private UUID id;

  @Column(name = "full_name")
  private String fullName;

  /** Preferred display currency, or null to use the configured default. */
  @Column(name = "preferred_currency", length = 3)
  private String preferredCurrency;

  protected UserProfile() {}

  public UserProfile(UUID id, String fullName, String preferredCurrency) {
    this.id = id;
    this.fullName = fullName;
    this.preferredCurrency = preferredCurrency;
  }

  public UUID getId() {
    return id;
  }

  public String getFullName() {
    return fullName;
  }

  public String getPreferredCurrency() {
    return preferredCurrency;
  }
}
