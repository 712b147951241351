package com.govledger.service;

import com.govledger.domain.Member;
import com.govledger.exception.InvalidInputException;
import com.govledger.repository.MemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Member registry: the identities allowed to sign in and act on the ledger.
 *
 * Password hashing uses BCryptPasswordEncoder (cost factor 12).
 * Plaintext passwords are never stored or logged.
 */
@Service
@Transactional
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);

    private final MemberRepository memberRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public MemberService(MemberRepository memberRepository,
                         PasswordEncoder passwordEncoder,
                         Clock clock) {
        this.memberRepository = memberRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    /**
     * Register a new member with a BCrypt-hashed password.
     *
     * @param address       ledger identity (must be unique, surrounding whitespace is stripped)
     * @param plainPassword plaintext password - hashed immediately, never stored
     * @return created member
     * @throws InvalidInputException if the address is blank or already registered
     */
    public Member register(String address, String plainPassword) {
        if (address == null || address.isBlank()) {
            throw new InvalidInputException("Address cannot be null or blank");
        }
        String normalized = address.strip();

        if (memberRepository.existsByAddress(normalized)) {
            log.warn("✗ Registration rejected - address already registered: {}", normalized);
            throw new InvalidInputException("Address already registered: " + normalized);
        }

        Member member = memberRepository.save(
                new Member(normalized, passwordEncoder.encode(plainPassword), Instant.now(clock)));
        log.info("✓ Member registered - memberId={}, address={}", member.getId(), member.getAddress());
        return member;
    }

    /**
     * Verify credentials.
     *
     * @return the member if the address exists and the password matches
     */
    @Transactional(readOnly = true)
    public Optional<Member> authenticate(String address, String plainPassword) {
        if (address == null || plainPassword == null) {
            return Optional.empty();
        }
        return memberRepository.findByAddress(address.strip())
                .filter(member -> passwordEncoder.matches(plainPassword, member.getPasswordHash()));
    }
}
