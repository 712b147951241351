package com.govledger.event;

/**
 * Notification emitted after a committed ledger mutation.
 *
 * Published through Spring's {@code ApplicationEventPublisher}; listeners
 * should subscribe with {@code @TransactionalEventListener} so that only
 * committed changes are observed.
 */
public interface GovernanceEvent {

    /** Notification kind, e.g. {@code ProposalCreated}. */
    String kind();

    /** Seconds since epoch at which the change was applied. */
    long timestamp();
}
