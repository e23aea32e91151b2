package com.paymentsengine.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaymentsCliApplication {
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(PaymentsCliApplication.class, args)));
  }
}
