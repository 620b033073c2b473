package org.budgetanalyzer.finance.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.Investment;

public interface InvestmentRepository extends JpaRepository<Investment, UUID> {

  List<Investment> findByUserIdOrderByNameAsc(UUID userId);
}
