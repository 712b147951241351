package com.govledger.event;

public record ProposalCreatedEvent(long id, String title, String creator, long timestamp)
        implements GovernanceEvent {

    @Override
    public String kind() {
        return "ProposalCreated";
    }
}
