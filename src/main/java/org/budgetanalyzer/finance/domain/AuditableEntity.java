package org.budgetanalyzer.finance.domain;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * Common audit columns for records owned by the external write path.
 *
 * <p>This service never writes these tables, so the timestamps are mapped read-only.
 */
@MappedSuperclass
public abstract class AuditableEntity {

  @Column(name = "created_at", insertable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", insertable = false, updatable = false)
  private Instant updatedAt;

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
