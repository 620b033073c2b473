package org.budgetanalyzer.finance.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.Account;

public interface AccountRepository extends JpaRepository<Account, UUID> {

  List<Account> findByUserIdOrderByNameAsc(UUID userId);
}
