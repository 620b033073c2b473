package org.budgetanalyzer.finance.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.Debt;

public interface DebtRepository extends JpaRepository<Debt, UUID> {

  List<Debt> findByUserIdOrderByDueDateAsc(UUID userId);
}
