package org.budgetanalyzer.finance.domain;

/** A financial record carrying a single {@link Money} amount. */
public interface MonetaryRecord {

  Money getAmount();
}
