package com.govledger.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes every committed governance notification to the application log.
 */
@Component
public class GovernanceEventLogger {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEventLogger.class);

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProposalCreated(ProposalCreatedEvent event) {
        log.info("📢 ProposalCreated - id={}, title='{}', creator={}, timestamp={}",
                event.id(), event.title(), event.creator(), event.timestamp());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onVoted(VotedEvent event) {
        log.info("📢 Voted - voter={}, id={}, support={}, timestamp={}",
                event.voter(), event.id(), event.support(), event.timestamp());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProposalClosed(ProposalClosedEvent event) {
        log.info("📢 ProposalClosed - id={}, yesCount={}, noCount={}, timestamp={}",
                event.id(), event.yesCount(), event.noCount(), event.timestamp());
    }
}
