package org.budgetanalyzer.finance.service.dto;

import org.budgetanalyzer.finance.engine.ConversionResult;
import org.budgetanalyzer.finance.engine.GoalProgress;

/**
 * A financial goal with its amounts rendered in the display currency.
 *
 * @param progress progress figures
 * @param target rendered target amount
 * @param saved rendered saved amount
 * @param remaining rendered remaining amount
 */
public record GoalView(
    GoalProgress progress,
    ConversionResult target,
    ConversionResult saved,
    ConversionResult remaining) {}
