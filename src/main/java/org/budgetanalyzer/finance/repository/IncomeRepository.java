package org.budgetanalyzer.finance.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.Income;

public interface IncomeRepository extends JpaRepository<Income, UUID> {

  /**
   * Find a user's income records whose start date falls within a range.
   *
   * @param userId the user id
   * @param from start of the range (inclusive)
   * @param to end of the range (inclusive)
   * @return matching income records, newest first
   */
  List<Income> findByUserIdAndStartDateBetweenOrderByStartDateDesc(
      UUID userId, LocalDate from, LocalDate to);
}
