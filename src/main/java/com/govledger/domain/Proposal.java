package com.govledger.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * Proposal entity - a governance item subject to yes/no voting.
 *
 * LIFECYCLE RULES:
 * 1. Identifier is assigned by the ledger (0-based, sequential) and never reused
 * 2. Title, description, creator and createdAt are fixed at construction
 * 3. Tallies only ever grow, by exactly one per counted vote
 * 4. Closing is terminal - an inactive proposal never becomes active again
 *
 * Design decisions:
 * - No generated id: the ledger hands out ids from its proposal count so that
 *   the valid id range is always [0, count)
 * - No setters; tallies and the active flag change only through business methods
 * - Optimistic locking via @Version as a second line behind the ledger lock
 */
@Entity
@Table(
    name = "proposals",
    indexes = {
        @Index(name = "idx_proposals_active", columnList = "active"),
        @Index(name = "idx_proposals_creator", columnList = "creator")
    }
)
public class Proposal {

    @Id
    private Long id;

    @Column(nullable = false, length = 200, updatable = false)
    private String title;

    @Column(nullable = false, length = 4000, updatable = false)
    private String description;

    @Column(name = "yes_count", nullable = false)
    private long yesCount;

    @Column(name = "no_count", nullable = false)
    private long noCount;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false, length = 128, updatable = false)
    private String creator;

    @Version
    private Long version;

    /**
     * JPA requires a no-arg constructor.
     */
    protected Proposal() {
    }

    /**
     * Create a new, active proposal with empty tallies.
     *
     * @param id          sequential identifier handed out by the ledger
     * @param title       non-blank title
     * @param description non-blank description
     * @param creator     identity of the creating administrator
     * @param createdAt   creation time
     * @throws IllegalArgumentException if any argument is missing
     */
    public Proposal(Long id, String title, String description, String creator, Instant createdAt) {
        if (id == null || id < 0) {
            throw new IllegalArgumentException("Proposal id must be a non-negative number");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title cannot be null or blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description cannot be null or blank");
        }
        if (creator == null || creator.isBlank()) {
            throw new IllegalArgumentException("Creator cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        this.id = id;
        this.title = title;
        this.description = description;
        this.creator = creator;
        this.createdAt = createdAt;
        this.yesCount = 0;
        this.noCount = 0;
        this.active = true;
    }

    // Getters

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public long getYesCount() {
        return yesCount;
    }

    public long getNoCount() {
        return noCount;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getCreator() {
        return creator;
    }

    public Long getVersion() {
        return version;
    }

    public long getTotalVotes() {
        return yesCount + noCount;
    }

    // Business methods

    /**
     * Count one vote into the tally.
     *
     * The caller is responsible for the duplicate-vote check; this method only
     * guards the lifecycle.
     *
     * @throws IllegalStateException if the proposal is closed
     */
    public void recordVote(boolean support) {
        if (!active) {
            throw new IllegalStateException("Cannot count a vote on closed proposal " + id);
        }
        if (support) {
            yesCount++;
        } else {
            noCount++;
        }
    }

    /**
     * Permanently close the proposal.
     *
     * @throws IllegalStateException if already closed
     */
    public void close() {
        if (!active) {
            throw new IllegalStateException("Proposal " + id + " is already closed");
        }
        this.active = false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Proposal proposal = (Proposal) o;
        return Objects.equals(id, proposal.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Proposal{" +
                "id=" + id +
                ", title='" + title + '\'' +
                ", yesCount=" + yesCount +
                ", noCount=" + noCount +
                ", active=" + active +
                ", creator='" + creator + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
