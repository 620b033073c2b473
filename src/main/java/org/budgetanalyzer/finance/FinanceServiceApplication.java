package org.budgetanalyzer.finance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinanceServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(FinanceServiceApplication.class, args);
  }
}
