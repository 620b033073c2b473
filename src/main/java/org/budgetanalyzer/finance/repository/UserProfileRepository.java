package org.budgetanalyzer.finance.repository;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.finance.domain.UserProfile;

public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {}
