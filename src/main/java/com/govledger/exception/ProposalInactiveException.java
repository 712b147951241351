package com.govledger.exception;

/**
 * A vote was cast on a proposal that has been closed.
 */
public class ProposalInactiveException extends IllegalStateException implements GovernanceViolation {

    private final long proposalId;

    public ProposalInactiveException(long proposalId) {
        super("Proposal " + proposalId + " is closed and no longer accepts votes");
        this.proposalId = proposalId;
    }

    public long getProposalId() {
        return proposalId;
    }

    @Override
    public String errorCode() {
        return "INACTIVE";
    }
}
