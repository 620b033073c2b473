package org.budgetanalyzer.finance.engine;

import java.util.Collection;
import java.util.List;

import org.springframework.stereotype.Component;

import org.budgetanalyzer.finance.domain.FinancialGoal;
import org.budgetanalyzer.finance.domain.Money;

/**
 * Computes savings progress of financial goals.
 *
 * <p>Progress compares the reporting amounts so goals in different currencies are ranked alike;
 * the remaining amount stays in the goal currency for display.
 */
@Component
public class GoalProgressCalculator {

  public List<GoalProgress> computeProgress(Collection<FinancialGoal> goals) {
    if (goals == null) {
      return List.of();
    }
    return goals.stream().map(this::computeProgress).toList();
  }

  public GoalProgress computeProgress(FinancialGoal goal) {
    var targetNative = nativeOrZero(goal.getTarget());
    var savedNative = nativeOrZero(goal.getSaved());

    return new GoalProgress(
        goal.getId(),
        goal.getName(),
        goal.getStatus(),
        goal.getTargetDate(),
        goal.getTarget(),
        goal.getSaved(),
        targetNative - savedNative,
        progress(reportingOrZero(goal.getSaved()), reportingOrZero(goal.getTarget())));
  }

  /**
   * Share of the target already saved.
   *
   * @param saved amount saved
   * @param target target amount
   * @return percentage within [0, 100], zero when the target is not positive
   */
  public static double progress(double saved, double target) {
    if (target <= 0) {
      return 0.0;
    }
    return Math.min(100, Math.max(0, saved / target * 100));
  }

  private static double reportingOrZero(Money money) {
    return money != null ? money.reportingOrZero() : 0.0;
  }

  private static double nativeOrZero(Money money) {
    return money != null && money.getNativeAmount() != null ? money.getNativeAmount() : 0.0;
  }
}
