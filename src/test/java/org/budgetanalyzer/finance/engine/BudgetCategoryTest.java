package org.budgetanalyzer.finance.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("BudgetCategory")
class BudgetCategoryTest {

  @ParameterizedTest
  @CsvSource({
    "food_and_drink, Food And Drink",
    "housing, Housing",
    "LEISURE_TRAVEL, Leisure Travel",
    "home_office_supplies, Home Office Supplies"
  })
  @DisplayName("Should title case category slugs")
  void displayName_slug_returnsTitle(String slug, String expected) {
    assertThat(BudgetCategory.displayName(slug)).isEqualTo(expected);
  }

  @Test
  @DisplayName("Should return empty display name for null slug")
  void displayName_null_returnsEmpty() {
    assertThat(BudgetCategory.displayName(null)).isEmpty();
  }

  @Test
  @DisplayName("Should resolve default categories ignoring case")
  void fromSlug_defaultCategory_ignoresCase() {
    assertThat(BudgetCategory.fromSlug("Health_And_Wellness"))
        .contains(BudgetCategory.HEALTH_AND_WELLNESS);
    assertThat(BudgetCategory.fromSlug("home_office_supplies")).isEmpty();
    assertThat(BudgetCategory.values()).hasSize(16);
  }
}
