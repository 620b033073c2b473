package org.budgetanalyzer.finance.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.Currency;

/** Repository for currency metadata. */
public interface CurrencyRepository extends JpaRepository<Currency, String> {

  /**
   * Find all active currencies.
   *
   * @return active currencies ordered by display name
   */
  List<Currency> findByActiveTrueOrderByNameAsc();

  /**
   * Find all currencies regardless of active status.
   *
   * @return all currencies ordered by display name
   */
  List<Currency> findAllByOrderByNameAsc();
}
