package com.govledger.dto;

import com.govledger.domain.Member;
import com.govledger.domain.Proposal;
import com.govledger.domain.ProposalInfo;
import com.govledger.domain.VotePercentages;
import com.govledger.event.GovernanceEvent;

import java.time.Instant;

/**
 * Response DTOs for API endpoints.
 */
public class ApiResponses {

    /**
     * Proposal creation response.
     */
    public static class ProposalCreatedResponse {
        private long proposalId;

        public ProposalCreatedResponse(long proposalId) {
            this.proposalId = proposalId;
        }

        public long getProposalId() { return proposalId; }
    }

    /**
     * Public proposal state: title, description, tallies and active flag.
     */
    public static class ProposalInfoResponse {
        private long proposalId;
        private String title;
        private String description;
        private long yesCount;
        private long noCount;
        private boolean active;

        public ProposalInfoResponse(long proposalId, ProposalInfo info) {
            this.proposalId = proposalId;
            this.title = info.title();
            this.description = info.description();
            this.yesCount = info.yesCount();
            this.noCount = info.noCount();
            this.active = info.active();
        }

        public long getProposalId() { return proposalId; }
        public String getTitle() { return title; }
        public String getDescription() { return description; }
        public long getYesCount() { return yesCount; }
        public long getNoCount() { return noCount; }
        public boolean isActive() { return active; }
    }

    /**
     * Full proposal view including creator and creation time.
     */
    public static class ProposalDetailsResponse {
        private long proposalId;
        private String title;
        private String description;
        private long yesCount;
        private long noCount;
        private boolean active;
        private String creator;
        private long createdAt;
        private long voterCount;

        public ProposalDetailsResponse(Proposal proposal, long voterCount) {
            this.proposalId = proposal.getId();
            this.title = proposal.getTitle();
            this.description = proposal.getDescription();
            this.yesCount = proposal.getYesCount();
            this.noCount = proposal.getNoCount();
            this.active = proposal.isActive();
            this.creator = proposal.getCreator();
            this.createdAt = proposal.getCreatedAt().getEpochSecond();
            this.voterCount = voterCount;
        }

        public long getProposalId() { return proposalId; }
        public String getTitle() { return title; }
        public String getDescription() { return description; }
        public long getYesCount() { return yesCount; }
        public long getNoCount() { return noCount; }
        public boolean isActive() { return active; }
        public String getCreator() { return creator; }
        public long getCreatedAt() { return createdAt; }
        public long getVoterCount() { return voterCount; }
    }

    /**
     * Vote shares in basis points (10000 == 100.00%).
     */
    public static class VotePercentagesResponse {
        private long proposalId;
        private long yesPct;
        private long noPct;

        public VotePercentagesResponse(long proposalId, VotePercentages percentages) {
            this.proposalId = proposalId;
            this.yesPct = percentages.yesPct();
            this.noPct = percentages.noPct();
        }

        public long getProposalId() { return proposalId; }
        public long getYesPct() { return yesPct; }
        public long getNoPct() { return noPct; }
    }

    public static class ProposalResultResponse {
        private long proposalId;
        private boolean approved;

        public ProposalResultResponse(long proposalId, boolean approved) {
            this.proposalId = proposalId;
            this.approved = approved;
        }

        public long getProposalId() { return proposalId; }
        public boolean isApproved() { return approved; }
    }

    public static class HasVotedResponse {
        private long proposalId;
        private String voter;
        private boolean hasVoted;

        public HasVotedResponse(long proposalId, String voter, boolean hasVoted) {
            this.proposalId = proposalId;
            this.voter = voter;
            this.hasVoted = hasVoted;
        }

        public long getProposalId() { return proposalId; }
        public String getVoter() { return voter; }
        public boolean isHasVoted() { return hasVoted; }
    }

    /**
     * Queryable ledger state: administrator identity and proposal count.
     */
    public static class GovernanceStateResponse {
        private String administrator;
        private long proposalCount;

        public GovernanceStateResponse(String administrator, long proposalCount) {
            this.administrator = administrator;
            this.proposalCount = proposalCount;
        }

        public String getAdministrator() { return administrator; }
        public long getProposalCount() { return proposalCount; }
    }

    public static class MemberResponse {
        private Long memberId;
        private String address;
        private Instant registeredAt;

        public MemberResponse(Member member) {
            this.memberId = member.getId();
            this.address = member.getAddress();
            this.registeredAt = member.getRegisteredAt();
        }

        public Long getMemberId() { return memberId; }
        public String getAddress() { return address; }
        public Instant getRegisteredAt() { return registeredAt; }
    }

    /**
     * Notification feed entry: the kind plus the notification's named fields.
     */
    public static class EventResponse {
        private String kind;
        private GovernanceEvent payload;

        public EventResponse(GovernanceEvent event) {
            this.kind = event.kind();
            this.payload = event;
        }

        public String getKind() { return kind; }
        public GovernanceEvent getPayload() { return payload; }
    }

    /**
     * Error response.
     */
    public static class ErrorResponse {
        private String error;
        private String message;
        private Instant timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = Instant.now();
        }

        public String getError() { return error; }
        public String getMessage() { return message; }
        public Instant getTimestamp() { return timestamp; }
    }
}
