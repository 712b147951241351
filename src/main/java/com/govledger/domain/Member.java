package com.govledger.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * Member entity - an identity that can authenticate against the ledger.
 *
 * The address is the identity the ledger sees as creator, voter or caller.
 * Membership grants no privileges by itself; administrator rights come from
 * {@link LedgerState} alone.
 *
 * Design decisions:
 * - Address is the natural unique key
 * - Password stored as hash only (never plaintext)
 * - Members are never deleted, so vote records always refer to a known address
 */
@Entity
@Table(
    name = "members",
    indexes = {
        @Index(name = "idx_members_address", columnList = "address", unique = true)
    }
)
public class Member {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 128)
    private String address;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    protected Member() {
    }

    /**
     * @param address      the member's ledger identity (must be unique)
     * @param passwordHash bcrypt hashed password
     * @param registeredAt registration time
     */
    public Member(String address, String passwordHash, Instant registeredAt) {
        this.address = address;
        this.passwordHash = passwordHash;
        this.registeredAt = registeredAt;
    }

    public Long getId() {
        return id;
    }

    public String getAddress() {
        return address;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Member member = (Member) o;
        return Objects.equals(address, member.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address);
    }

    @Override
    public String toString() {
        return "Member{" +
                "id=" + id +
                ", address='" + address + '\'' +
                ", registeredAt=" + registeredAt +
                '}';
    }
}
