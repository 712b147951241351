package com.govledger.service;

import com.govledger.domain.LedgerState;
import com.govledger.domain.Proposal;
import com.govledger.domain.ProposalInfo;
import com.govledger.event.ProposalClosedEvent;
import com.govledger.event.ProposalCreatedEvent;
import com.govledger.exception.InvalidInputException;
import com.govledger.exception.ProposalAlreadyClosedException;
import com.govledger.exception.ProposalNotFoundException;
import com.govledger.exception.UnauthorizedCallerException;
import com.govledger.repository.LedgerStateRepository;
import com.govledger.repository.ProposalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Proposal store: creation, closing and lookup of proposals.
 *
 * CRITICAL: mutating methods follow the ledger protocol
 * 1. Lock the ledger state row (AccessControlService.lockLedger)
 * 2. Validate existence, authorization and lifecycle - no writes yet
 * 3. Write proposal / state changes
 * 4. Publish the notification (delivered to listeners after commit)
 */
@Service
@Transactional
public class ProposalService {

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 4000;

    private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

    private final ProposalRepository proposalRepository;
    private final LedgerStateRepository ledgerStateRepository;
    private final AccessControlService accessControl;
    private final ApplicationEventPublisher eventPublisher;

    public ProposalService(ProposalRepository proposalRepository,
                           LedgerStateRepository ledgerStateRepository,
                           AccessControlService accessControl,
                           ApplicationEventPublisher eventPublisher) {
        this.proposalRepository = proposalRepository;
        this.ledgerStateRepository = ledgerStateRepository;
        this.accessControl = accessControl;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Create a new active proposal with empty tallies.
     *
     * @param title       non-blank, at most 200 characters
     * @param description non-blank, at most 4000 characters
     * @param creator     caller identity; must be the administrator
     * @return the new proposal's id (equal to the previous proposal count)
     * @throws UnauthorizedCallerException if creator is not the administrator
     * @throws InvalidInputException       if title or description is empty or too long
     */
    public long create(String title, String description, String creator) {
        LedgerState state = accessControl.lockLedger();

        accessControl.requireAdministrator(state, creator, "create proposals");
        validateText("Title", title, MAX_TITLE_LENGTH);
        validateText("Description", description, MAX_DESCRIPTION_LENGTH);

        Instant now = accessControl.now();
        long id = state.allocateProposalId(now);

        Proposal proposal = proposalRepository.save(new Proposal(id, title, description, creator, now));
        ledgerStateRepository.save(state);

        log.info("✓ Proposal created - id={}, creator={}, proposalCount={}",
                proposal.getId(), creator, state.getProposalCount());

        eventPublisher.publishEvent(new ProposalCreatedEvent(id, title, creator, now.getEpochSecond()));
        return id;
    }

    /**
     * Permanently close a proposal. Closed proposals reject further votes.
     *
     * @param proposalId proposal to close
     * @param caller     caller identity; must be the administrator
     * @throws ProposalNotFoundException      if proposalId is outside [0, count)
     * @throws UnauthorizedCallerException    if caller is not the administrator
     * @throws ProposalAlreadyClosedException if the proposal is already closed
     */
    public void close(long proposalId, String caller) {
        LedgerState state = accessControl.lockLedger();

        if (!state.containsProposal(proposalId)) {
            log.warn("✗ Close rejected - proposal {} not found (count={})", proposalId, state.getProposalCount());
            throw new ProposalNotFoundException(proposalId);
        }
        accessControl.requireAdministrator(state, caller, "close proposals");

        Proposal proposal = proposalRepository.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));
        if (!proposal.isActive()) {
            log.warn("✗ Close rejected - proposal {} already closed", proposalId);
            throw new ProposalAlreadyClosedException(proposalId);
        }

        proposal.close();
        proposalRepository.save(proposal);

        log.info("✓ Proposal closed - id={}, yesCount={}, noCount={}",
                proposalId, proposal.getYesCount(), proposal.getNoCount());

        eventPublisher.publishEvent(new ProposalClosedEvent(
                proposalId, proposal.getYesCount(), proposal.getNoCount(),
                accessControl.now().getEpochSecond()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Queries
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Load a proposal, treating ids outside [0, count) as not found.
     *
     * @throws ProposalNotFoundException if the id is not valid
     */
    @Transactional(readOnly = true)
    public Proposal getProposal(long proposalId) {
        if (!accessControl.readState().containsProposal(proposalId)) {
            throw new ProposalNotFoundException(proposalId);
        }
        return proposalRepository.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));
    }

    @Transactional(readOnly = true)
    public ProposalInfo getProposalInfo(long proposalId) {
        return ProposalInfo.of(getProposal(proposalId));
    }

    /** Every id ever handed out, 0..count-1 in ascending order. */
    @Transactional(readOnly = true)
    public List<Long> getAllProposalIds() {
        long count = accessControl.readState().getProposalCount();
        return LongStream.range(0, count).boxed().collect(Collectors.toList());
    }

    /** Ids of proposals still accepting votes, ascending. Linear in the proposal count. */
    @Transactional(readOnly = true)
    public List<Long> getActiveProposalIds() {
        return proposalRepository.findActiveIds();
    }

    private void validateText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " cannot be empty");
        }
        if (value.length() > maxLength) {
            throw new InvalidInputException(
                field + " cannot be longer than " + maxLength + " characters");
        }
    }
}
