package com.govledger.repository;

import com.govledger.domain.LedgerState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the singleton {@link LedgerState} row.
 *
 * 1. findByIdForUpdate(Long id)
 *    WHY: The ledger state row is the single mutual-exclusion point for every
 *    mutating request (create, vote, close, administrator transfer).
 *    LOCKING: PESSIMISTIC_WRITE - SELECT ... FOR UPDATE, held until commit/rollback.
 *    EXAMPLE SCENARIO:
 *      - Request A locks the state row and validates vote (proposal 0, voter X)
 *      - Request B for the same pair attempts to lock -> WAITS
 *      - Request A records the vote and COMMITS
 *      - Request B acquires the lock, sees the vote record, fails with DuplicateVote
 *
 * Read-only queries use the inherited findById (no lock).
 */
@Repository
public interface LedgerStateRepository extends JpaRepository<LedgerState, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM LedgerState s WHERE s.id = :id")
    Optional<LedgerState> findByIdForUpdate(@Param("id") Long id);
}
