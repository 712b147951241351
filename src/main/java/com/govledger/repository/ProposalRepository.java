package com.govledger.repository;

import com.govledger.domain.Proposal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for {@link Proposal} entities.
 *
 * Proposals are never deleted; ids are dense in [0, proposalCount), so the
 * inherited findById doubles as the existence check once the range is verified.
 *
 * 1. findActiveIds()
 *    WHY: Active proposal listing, ascending by id.
 *    COST: Filter over the whole table (backed by idx_proposals_active).
 */
@Repository
public interface ProposalRepository extends JpaRepository<Proposal, Long> {

    @Query("SELECT p.id FROM Proposal p WHERE p.active = true ORDER BY p.id ASC")
    List<Long> findActiveIds();
}
