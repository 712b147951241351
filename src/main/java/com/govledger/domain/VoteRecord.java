package com.govledger.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * VoteRecord entity - the fact that an identity has voted on a proposal.
 *
 * RULES:
 * 1. Records are IMMUTABLE and APPEND-ONLY - a cast vote is never changed or retracted
 * 2. At most one record exists per (proposalId, voter) pair
 * 3. The yes/no choice is not stored here; it lives only in the proposal tally
 *
 * The unique index on (proposal_id, voter) is the database-level safety net
 * behind the service-level duplicate check.
 */
@Entity
@Table(
    name = "vote_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_vote_records_proposal_voter", columnNames = {"proposal_id", "voter"})
    },
    indexes = {
        @Index(name = "idx_vote_records_voter", columnList = "voter")
    }
)
public class VoteRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "proposal_id", nullable = false, updatable = false)
    private Long proposalId;

    @Column(nullable = false, length = 128, updatable = false)
    private String voter;

    @Column(name = "cast_at", nullable = false, updatable = false)
    private Instant castAt;

    private VoteRecord() {
    }

    public VoteRecord(Long proposalId, String voter, Instant castAt) {
        if (proposalId == null) {
            throw new IllegalArgumentException("Proposal id cannot be null");
        }
        if (voter == null || voter.isBlank()) {
            throw new IllegalArgumentException("Voter cannot be null or blank");
        }
        if (castAt == null) {
            throw new IllegalArgumentException("Cast time cannot be null");
        }
        this.proposalId = proposalId;
        this.voter = voter;
        this.castAt = castAt;
    }

    public Long getId() {
        return id;
    }

    public Long getProposalId() {
        return proposalId;
    }

    public String getVoter() {
        return voter;
    }

    public Instant getCastAt() {
        return castAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VoteRecord that = (VoteRecord) o;
        return Objects.equals(proposalId, that.proposalId) && Objects.equals(voter, that.voter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proposalId, voter);
    }

    @Override
    public String toString() {
        return "VoteRecord{" +
                "proposalId=" + proposalId +
                ", voter='" + voter + '\'' +
                ", castAt=" + castAt +
                '}';
    }
}
