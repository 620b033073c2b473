package org.budgetanalyzer.finance.base;

import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

import org.budgetanalyzer.finance.config.TestContainersConfiguration;

/**
 * Base class for repository tests against a real PostgreSQL schema built by Flyway.
 *
 * <p>Each test runs in a transaction that is rolled back afterwards. Skipped when Docker is not
 * available.
 */
@DataJpaTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(TestContainersConfiguration.class)
public abstract class AbstractRepositoryTest {
  // PostgreSQL container is imported from TestContainersConfiguration
}
