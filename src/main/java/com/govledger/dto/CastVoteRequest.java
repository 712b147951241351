package com.govledger.dto;

import jakarta.validation.constraints.NotNull;

/**
 * DTO for casting a vote. {@code support=true} is a yes vote.
 */
public class CastVoteRequest {

    @NotNull(message = "Support is required (true = yes, false = no)")
    private Boolean support;

    public CastVoteRequest() {
    }

    public CastVoteRequest(Boolean support) {
        this.support = support;
    }

    public Boolean getSupport() {
        return support;
    }

    public void setSupport(Boolean support) {
        this.support = support;
    }
}
