package org.budgetanalyzer.finance.engine;

import java.time.LocalDate;
import java.util.UUID;

import org.budgetanalyzer.finance.domain.Money;

/**
 * Progress of one financial goal.
 *
 * @param goalId goal identifier
 * @param name goal name
 * @param status goal status
 * @param targetDate date the goal should be reached, may be {@code null}
 * @param target target amount
 * @param saved amount saved so far
 * @param remainingNative target minus saved, in the goal currency
 * @param progressPercent saved as a share of target, within [0, 100]
 */
public record GoalProgress(
    UUID goalId,
    String name,
    String status,
    LocalDate targetDate,
    Money target,
    Money saved,
    double remainingNative,
    double progressPercent) {}
