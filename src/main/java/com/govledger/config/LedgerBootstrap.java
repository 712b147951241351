package com.govledger.config;

import com.govledger.domain.LedgerState;
import com.govledger.service.AccessControlService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the ledger state row on first start-up.
 *
 * The configured initial address plays the deployer: it becomes administrator
 * only if no ledger state exists yet. On later starts the stored administrator
 * wins, so a completed transfer survives restarts.
 */
@Component
public class LedgerBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LedgerBootstrap.class);

    private final AccessControlService accessControl;
    private final String initialAdministrator;

    public LedgerBootstrap(AccessControlService accessControl,
                           @Value("${govledger.admin.initial-address:}") String initialAdministrator) {
        this.accessControl = accessControl;
        this.initialAdministrator = initialAdministrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        LedgerState state = accessControl.initialize(initialAdministrator);
        log.info("Governance ledger ready - administrator={}, proposalCount={}",
                state.getAdministrator(), state.getProposalCount());
    }
}
