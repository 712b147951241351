package com.govledger.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Singleton ledger state row: the administrator identity and the proposal count.
 *
 * This row doubles as the ledger-wide write lock. Every mutating operation
 * loads it with PESSIMISTIC_WRITE before validating anything, so create, vote,
 * close and administrator transfer are applied strictly one at a time.
 *
 * INVARIANTS:
 * - proposalCount only grows, by exactly one per created proposal
 * - proposalCount is both the next proposal id and the exclusive upper bound
 *   of valid ids
 * - administrator is never blank
 */
@Entity
@Table(name = "ledger_state")
public class LedgerState {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false, length = 128)
    private String administrator;

    @Column(name = "proposal_count", nullable = false)
    private long proposalCount;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected LedgerState() {
    }

    /**
     * Create the initial ledger state with no proposals.
     *
     * @param administrator the deployer identity that starts out as administrator
     * @param now           creation time
     */
    public LedgerState(String administrator, Instant now) {
        if (administrator == null || administrator.isBlank()) {
            throw new IllegalArgumentException("Initial administrator cannot be null or blank");
        }
        this.id = SINGLETON_ID;
        this.administrator = administrator;
        this.proposalCount = 0;
        this.updatedAt = now;
    }

    public Long getId() {
        return id;
    }

    public String getAdministrator() {
        return administrator;
    }

    public long getProposalCount() {
        return proposalCount;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public boolean isAdministrator(String identity) {
        return identity != null && administrator.equals(identity);
    }

    /** True iff {@code proposalId} lies in [0, proposalCount). */
    public boolean containsProposal(long proposalId) {
        return proposalId >= 0 && proposalId < proposalCount;
    }

    /**
     * Hand out the next proposal id and advance the count.
     *
     * @return the id the new proposal must use
     */
    public long allocateProposalId(Instant now) {
        long next = proposalCount;
        proposalCount = next + 1;
        updatedAt = now;
        return next;
    }

    public void changeAdministrator(String newAdministrator, Instant now) {
        if (newAdministrator == null || newAdministrator.isBlank()) {
            throw new IllegalArgumentException("Administrator cannot be null or blank");
        }
        this.administrator = newAdministrator;
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        return "LedgerState{" +
                "administrator='" + administrator + '\'' +
                ", proposalCount=" + proposalCount +
                ", updatedAt=" + updatedAt +
                ", version=" + version +
                '}';
    }
}
