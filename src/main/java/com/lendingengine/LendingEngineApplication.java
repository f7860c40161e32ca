package com.lendingengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Lending Engine.
 *
 * Lending Engine is a singleton ledger of isolated lending markets: anyone can open a
 * market for a (collateral, loan token) pair, and the engine handles deposits,
 * collateralized borrowing, interest accrual and liquidation while delegating prices
 * and token custody to external providers.
 */
@SpringBootApplication
public class LendingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendingEngineApplication.class, args);
    }
}
