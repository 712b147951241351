package com.govledger.domain;

/**
 * Read-only snapshot of a proposal's public state, taken from a single row read.
 */
public record ProposalInfo(String title, String description, long yesCount, long noCount, boolean active) {

    public static ProposalInfo of(Proposal proposal) {
        return new ProposalInfo(
                proposal.getTitle(),
                proposal.getDescription(),
                proposal.getYesCount(),
                proposal.getNoCount(),
                proposal.isActive());
    }
}
