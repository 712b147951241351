package com.govledger.event;

/**
 * Carries the final tally of a closed proposal.
 */
public record ProposalClosedEvent(long id, long yesCount, long noCount, long timestamp)
        implements GovernanceEvent {

    @Override
    public String kind() {
        return "ProposalClosed";
    }
}
