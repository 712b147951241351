package com.govledger.repository;

import com.govledger.domain.VoteRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for {@link VoteRecord} entities.
 *
 * existsByProposalIdAndVoter is the duplicate-vote check. It is only
 * race-free when called while holding the ledger state lock; the unique
 * constraint uk_vote_records_proposal_voter is the final safety net.
 */
@Repository
public interface VoteRecordRepository extends JpaRepository<VoteRecord, Long> {

    boolean existsByProposalIdAndVoter(Long proposalId, String voter);

    long countByProposalId(Long proposalId);
}
