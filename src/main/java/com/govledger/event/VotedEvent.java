package com.govledger.event;

public record VotedEvent(String voter, long id, boolean support, long timestamp)
        implements GovernanceEvent {

    @Override
    public String kind() {
        return "Voted";
    }
}
