package org.budgetanalyzer.finance.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * TestContainers configuration shared by all integration and repository tests.
 *
 * <p>Containers are static so one PostgreSQL and one Redis instance serve every test class. Spring
 * Boot wires the datasource and Redis connection through {@link ServiceConnection}.
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestContainersConfiguration {

  static PostgreSQLContainer<?> postgresContainer =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:15-alpine"))
          .withCommand(
              "postgres", "-c", "max_connections=50") // prevent tests from overflowing hikari
          .withDatabaseName("finance_test")
          .withUsername("test")
          .withPassword("test")
          .withReuse(true);

  static GenericContainer<?> redisContainer =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
          .withExposedPorts(6379)
          .withReuse(true);

  @Bean
  @ServiceConnection
  PostgreSQLContainer<?> postgresContainer() {
    return postgresContainer;
  }

  @Bean
  @ServiceConnection(name = "redis")
  GenericContainer<?> redisContainer() {
    return redisContainer;
  }
}
