package com.govledger.service;

import com.govledger.domain.LedgerState;
import com.govledger.domain.Proposal;
import com.govledger.domain.VoteRecord;
import com.govledger.event.VotedEvent;
import com.govledger.exception.DuplicateVoteException;
import com.govledger.exception.InvalidInputException;
import com.govledger.exception.ProposalInactiveException;
import com.govledger.exception.ProposalNotFoundException;
import com.govledger.repository.ProposalRepository;
import com.govledger.repository.VoteRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Vote ledger: one counted vote per (proposal, voter) pair.
 *
 * INVARIANTS ENFORCED:
 * - Duplicate check and tally increment happen under the ledger lock, in one transaction
 * - yesCount + noCount grows by exactly 1 per successful castVote
 * - A cast vote is never changed or retracted
 */
@Service
@Transactional
public class VoteService {

    private static final Logger log = LoggerFactory.getLogger(VoteService.class);

    private final ProposalRepository proposalRepository;
    private final VoteRecordRepository voteRecordRepository;
    private final AccessControlService accessControl;
    private final ProposalService proposalService;
    private final ApplicationEventPublisher eventPublisher;

    public VoteService(ProposalRepository proposalRepository,
                       VoteRecordRepository voteRecordRepository,
                       AccessControlService accessControl,
                       ProposalService proposalService,
                       ApplicationEventPublisher eventPublisher) {
        this.proposalRepository = proposalRepository;
        this.voteRecordRepository = voteRecordRepository;
        this.accessControl = accessControl;
        this.proposalService = proposalService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Cast a yes/no vote.
     *
     * @param proposalId proposal to vote on
     * @param voter      voting identity
     * @param support    true for yes, false for no
     * @throws InvalidInputException     if voter is null or blank
     * @throws ProposalNotFoundException if proposalId is outside [0, count)
     * @throws ProposalInactiveException if the proposal is closed
     * @throws DuplicateVoteException    if voter already voted on this proposal
     */
    public void castVote(long proposalId, String voter, boolean support) {
        if (voter == null || voter.isBlank()) {
            throw new InvalidInputException("Voter cannot be null or blank");
        }

        LedgerState state = accessControl.lockLedger();

        if (!state.containsProposal(proposalId)) {
            log.warn("✗ Vote rejected - proposal {} not found (count={})", proposalId, state.getProposalCount());
            throw new ProposalNotFoundException(proposalId);
        }
        Proposal proposal = proposalRepository.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));
        if (!proposal.isActive()) {
            log.warn("✗ Vote rejected - proposal {} is closed, voter={}", proposalId, voter);
            throw new ProposalInactiveException(proposalId);
        }
        if (voteRecordRepository.existsByProposalIdAndVoter(proposalId, voter)) {
            log.warn("✗ Vote rejected - duplicate vote on proposal {} by {}", proposalId, voter);
            throw new DuplicateVoteException(proposalId, voter);
        }

        Instant now = accessControl.now();
        long totalBefore = proposal.getTotalVotes();

        voteRecordRepository.save(new VoteRecord(proposalId, voter, now));
        proposal.recordVote(support);
        proposalRepository.save(proposal);

        // POST-CONDITION: exactly one vote counted
        if (proposal.getTotalVotes() != totalBefore + 1) {
            throw new IllegalStateException(String.format(
                "Tally mismatch on proposal %d: expected %d votes, found %d",
                proposalId, totalBefore + 1, proposal.getTotalVotes()));
        }

        log.info("✓ Vote counted - proposal={}, voter={}, support={}, yes={}, no={}",
                proposalId, voter, support, proposal.getYesCount(), proposal.getNoCount());

        eventPublisher.publishEvent(new VotedEvent(voter, proposalId, support, now.getEpochSecond()));
    }

    /**
     * Whether {@code voter} has voted on the proposal. Unknown addresses simply return false.
     *
     * @throws ProposalNotFoundException if proposalId is outside [0, count)
     */
    @Transactional(readOnly = true)
    public boolean hasVoted(long proposalId, String voter) {
        if (!accessControl.readState().containsProposal(proposalId)) {
            throw new ProposalNotFoundException(proposalId);
        }
        if (voter == null || voter.isBlank()) {
            return false;
        }
        return voteRecordRepository.existsByProposalIdAndVoter(proposalId, voter);
    }

    /** Number of distinct voters recorded on the proposal. */
    @Transactional(readOnly = true)
    public long countVoters(long proposalId) {
        Proposal proposal = proposalService.getProposal(proposalId);
        return voteRecordRepository.countByProposalId(proposal.getId());
    }
}
