package com.govledger.exception;

/**
 * The identity has already voted on this proposal. Votes cannot be changed.
 */
public class DuplicateVoteException extends IllegalStateException implements GovernanceViolation {

    private final long proposalId;
    private final String voter;

    public DuplicateVoteException(long proposalId, String voter) {
        super("Address " + voter + " has already voted on proposal " + proposalId);
        this.proposalId = proposalId;
        this.voter = voter;
    }

    public long getProposalId() {
        return proposalId;
    }

    public String getVoter() {
        return voter;
    }

    @Override
    public String errorCode() {
        return "DUPLICATE_VOTE";
    }
}
