package org.budgetanalyzer.finance.service.dto;

import java.util.List;
import java.util.UUID;

/**
 * Financial goals of one user.
 *
 * @param userId user identifier
 * @param displayCurrency currency of the rendered amounts
 * @param goals goals ordered by target date
 */
public record GoalOverview(UUID userId, String displayCurrency, List<GoalView> goals) {}
