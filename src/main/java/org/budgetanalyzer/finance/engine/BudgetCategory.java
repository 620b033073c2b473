package org.budgetanalyzer.finance.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/** Default budget and expense categories offered to new users. */
public enum BudgetCategory {
  FOOD_AND_DRINK("food_and_drink"),
  HOUSING("housing"),
  UTILITIES("utilities"),
  TRANSPORTATION("transportation"),
  CLOTHING("clothing"),
  LEISURE_TRAVEL("leisure_travel"),
  TECHNOLOGY("technology"),
  PETS("pets"),
  HEALTH_AND_WELLNESS("health_and_wellness"),
  EDUCATION("education"),
  ENTERTAINMENT("entertainment"),
  GIFTS_AND_DONATIONS("gifts_and_donations"),
  PERSONAL_CARE("personal_care"),
  DEBT_PAYMENTS("debt_payments"),
  SAVINGS_AND_INVESTMENTS("savings_and_investments"),
  MISCELLANEOUS("miscellaneous");

  private final String slug;

  BudgetCategory(String slug) {
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }

  public String displayName() {
    return displayName(slug);
  }

  /**
   * Finds the default category for a slug, ignoring case.
   *
   * @param slug category slug as stored on budgets and expenses
   * @return the matching category, or empty for user-defined categories
   */
  public static Optional<BudgetCategory> fromSlug(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(c -> c.slug.equalsIgnoreCase(slug)).findFirst();
  }

  /**
   * Turns a category slug into a title: {@code food_and_drink} becomes {@code Food And Drink}.
   *
   * @param slug category slug, default or user-defined
   * @return display title, empty for a {@code null} slug
   */
  public static String displayName(String slug) {
    if (slug == null) {
      return "";
    }
    return Arrays.stream(slug.split("_"))
        .filter(word -> !word.isEmpty())
        .map(
            word ->
                word.substring(0, 1).toUpperCase(Locale.ROOT)
                    + word.substring(1).toLowerCase(Locale.ROOT))
        .collect(Collectors.joining(" "));
  }
}
