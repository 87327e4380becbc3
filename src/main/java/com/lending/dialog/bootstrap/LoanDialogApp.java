package com.lending.dialog.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Loan Dialog Orchestrator - Application Entry Point.
 * <p>
 * Guided loan onboarding, KYC refresh, support and post-loan servicing over
 * a button-and-text messaging channel.
 * </p>
 *
 * <pre>
 * Architecture: Hexagonal (Ports &amp; Adapters)
 * Pattern:      Per-identity dialog state machine (Load-Decide-Persist-Emit)
 * Tech:         Spring Boot 3.2 + Kafka + Redis + PostgreSQL
 * </pre>
 */
@SpringBootApplication(scanBasePackages = "com.lending.dialog")
@ConfigurationPropertiesScan("com.lending.dialog.bootstrap.config")
public class LoanDialogApp {

    public static void main(String[] args) {
        SpringApplication.run(LoanDialogApp.class, args);
    }
}
