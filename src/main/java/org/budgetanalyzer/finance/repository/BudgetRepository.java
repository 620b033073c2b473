package org.budgetanalyzer.finance.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.Budget;

public interface BudgetRepository extends JpaRepository<Budget, UUID> {

  /**
   * Find a user's budgets for one period.
   *
   * @param userId the user id
   * @param periodStartDate ISO date of the period's first day ({@code yyyy-MM-dd})
   * @return budgets ordered by category
   */
  List<Budget> findByUserIdAndPeriodStartDateOrderByCategoryAsc(
      UUID userId, String periodStartDate);
}
