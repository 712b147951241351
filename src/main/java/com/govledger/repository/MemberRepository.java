package com.govledger.repository;

import com.govledger.domain.Member;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for {@link Member} entities.
 * Lookups are by address, the natural key (case-sensitive).
 */
@Repository
public interface MemberRepository extends JpaRepository<Member, Long> {

    Optional<Member> findByAddress(String address);

    boolean existsByAddress(String address);
}
