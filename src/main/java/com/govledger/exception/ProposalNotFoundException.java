package com.govledger.exception;

import java.util.NoSuchElementException;

/**
 * Proposal identifier lies outside [0, proposalCount).
 */
public class ProposalNotFoundException extends NoSuchElementException implements GovernanceViolation {

    private final long proposalId;

    public ProposalNotFoundException(long proposalId) {
        super("Proposal not found: " + proposalId);
        this.proposalId = proposalId;
    }

    public long getProposalId() {
        return proposalId;
    }

    @Override
    public String errorCode() {
        return "NOT_FOUND";
    }
}
