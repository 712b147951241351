package com.govledger.service;

import com.govledger.domain.LedgerState;
import com.govledger.exception.InvalidInputException;
import com.govledger.exception.UnauthorizedCallerException;
import com.govledger.repository.LedgerStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Access controller: owns the administrator identity and the ledger-wide lock.
 *
 * CRITICAL: every mutating ledger operation MUST
 * 1. Call {@link #lockLedger()} before reading anything it validates
 * 2. Run every check before the first write
 * 3. Run inside one @Transactional unit so a failure rolls everything back
 */
@Service
@Transactional
public class AccessControlService {

    /** Width of the address columns (ledger_state.administrator, members.address). */
    public static final int MAX_ADDRESS_LENGTH = 128;

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    private final LedgerStateRepository ledgerStateRepository;
    private final Clock clock;

    public AccessControlService(LedgerStateRepository ledgerStateRepository, Clock clock) {
        this.ledgerStateRepository = ledgerStateRepository;
        this.clock = clock;
    }

    /**
     * Create the ledger state with its initial administrator, unless it exists.
     *
     * @param initialAdministrator the deployer identity
     * @return the existing or newly created state
     */
    public LedgerState initialize(String initialAdministrator) {
        return ledgerStateRepository.findById(LedgerState.SINGLETON_ID)
                .map(existing -> {
                    log.info("Ledger state found - administrator={}, proposalCount={}",
                            existing.getAdministrator(), existing.getProposalCount());
                    return existing;
                })
                .orElseGet(() -> {
                    if (initialAdministrator == null || initialAdministrator.isBlank()) {
                        throw new IllegalStateException(
                            "govledger.admin.initial-address must be set to bootstrap the ledger");
                    }
                    LedgerState created = ledgerStateRepository.save(
                            new LedgerState(initialAdministrator.strip(), now()));
                    log.info("✓ Ledger state initialized - administrator={}", created.getAdministrator());
                    return created;
                });
    }

    /**
     * Transfer administrator rights to another identity.
     *
     * Single step: the new administrator takes effect immediately and the
     * previous holder loses every privilege. No history is kept.
     *
     * @param newAdministrator identity that becomes administrator
     * @param caller           identity requesting the transfer
     * @throws UnauthorizedCallerException if caller is not the current administrator
     * @throws InvalidInputException       if newAdministrator is null, blank or longer than 128 characters
     */
    public void transferAdministrator(String newAdministrator, String caller) {
        LedgerState state = lockLedger();

        requireAdministrator(state, caller, "transfer administrator rights");

        if (newAdministrator == null || newAdministrator.isBlank()) {
            log.warn("✗ Administrator transfer rejected - empty target, caller={}", caller);
            throw new InvalidInputException("New administrator cannot be null or blank");
        }
        String target = newAdministrator.strip();
        if (target.length() > MAX_ADDRESS_LENGTH) {
            log.warn("✗ Administrator transfer rejected - target longer than {} chars, caller={}",
                    MAX_ADDRESS_LENGTH, caller);
            throw new InvalidInputException(
                "New administrator cannot be longer than " + MAX_ADDRESS_LENGTH + " characters");
        }

        String previous = state.getAdministrator();
        state.changeAdministrator(target, now());
        ledgerStateRepository.save(state);

        log.info("✓ Administrator transferred - from={}, to={}", previous, state.getAdministrator());
    }

    @Transactional(readOnly = true)
    public String getAdministrator() {
        return readState().getAdministrator();
    }

    @Transactional(readOnly = true)
    public long getProposalCount() {
        return readState().getProposalCount();
    }

    @Transactional(readOnly = true)
    public boolean isAdministrator(String identity) {
        return readState().isAdministrator(identity);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Shared with the other ledger services
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Acquire the ledger-wide write lock (PESSIMISTIC_WRITE on the state row).
     * Held until the surrounding transaction ends.
     */
    public LedgerState lockLedger() {
        return ledgerStateRepository.findByIdForUpdate(LedgerState.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Ledger state has not been initialized"));
    }

    /** Read the ledger state without locking. */
    public LedgerState readState() {
        return ledgerStateRepository.findById(LedgerState.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Ledger state has not been initialized"));
    }

    /**
     * Gate for administrator-only operations.
     *
     * @throws UnauthorizedCallerException if caller is not the administrator
     */
    public void requireAdministrator(LedgerState state, String caller, String action) {
        if (!state.isAdministrator(caller)) {
            log.warn("✗ Unauthorized - caller={} attempted to {}", caller, action);
            throw new UnauthorizedCallerException(caller, action);
        }
    }

    /** Current time at second precision. */
    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
