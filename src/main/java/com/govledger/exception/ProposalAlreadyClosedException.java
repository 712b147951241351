package com.govledger.exception;

public class ProposalAlreadyClosedException extends IllegalStateException implements GovernanceViolation {

    private final long proposalId;

    public ProposalAlreadyClosedException(long proposalId) {
        super("Proposal " + proposalId + " is already closed");
        this.proposalId = proposalId;
    }

    public long getProposalId() {
        return proposalId;
    }

    @Override
    public String errorCode() {
        return "ALREADY_CLOSED";
    }
}
