package com.govledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the Governance Ledger.
 * Records proposals, accepts one vote per address per proposal, tallies
 * results and restricts proposal creation and closing to the administrator.
 *
 * @EnableTransactionManagement is declared explicitly: every ledger mutation
 * depends on @Transactional for its all-or-nothing guarantee.
 */
@SpringBootApplication
@EnableTransactionManagement
public class GovernanceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernanceLedgerApplication.class, args);
    }

}
