package org.budgetanalyzer.finance.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.FinancialGoal;

public interface FinancialGoalRepository extends JpaRepository<FinancialGoal, UUID> {

  List<FinancialGoal> findByUserIdOrderByTargetDateAscNameAsc(UUID userId);
}
