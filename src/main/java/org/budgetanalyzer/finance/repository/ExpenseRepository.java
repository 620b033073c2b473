package org.budgetanalyzer.finance.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.Expense;

public interface ExpenseRepository extends JpaRepository<Expense, UUID> {

  /**
   * Find a user's expenses dated within a range.
   *
   * @param userId the user id
   * @param from start of the range (inclusive)
   * @param to end of the range (inclusive)
   * @return matching expenses, newest first
   */
  List<Expense> findByUserIdAndDateBetweenOrderByDateDesc(
      UUID userId, LocalDate from, LocalDate to);
}
