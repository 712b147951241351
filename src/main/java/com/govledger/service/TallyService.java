package com.govledger.service;

import com.govledger.domain.Proposal;
import com.govledger.domain.VotePercentages;
import com.govledger.exception.ProposalNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tally engine: read-only results derived from a proposal's vote counts.
 *
 * Nothing here writes state. Both values of a result come from the same
 * proposal row read, so yes and no counts are always consistent.
 */
@Service
@Transactional(readOnly = true)
public class TallyService {

    private final ProposalService proposalService;

    public TallyService(ProposalService proposalService) {
        this.proposalService = proposalService;
    }

    /**
     * Yes/no shares in basis points (10000 == 100.00%), floored.
     * (0, 0) when no votes were cast.
     *
     * @throws ProposalNotFoundException if proposalId is outside [0, count)
     */
    public VotePercentages getVotePercentages(long proposalId) {
        Proposal proposal = proposalService.getProposal(proposalId);
        return VotePercentages.of(proposal.getYesCount(), proposal.getNoCount());
    }

    /**
     * Approved iff yes votes strictly outnumber no votes. A tie is not approved.
     *
     * @throws ProposalNotFoundException if proposalId is outside [0, count)
     */
    public boolean getProposalResult(long proposalId) {
        Proposal proposal = proposalService.getProposal(proposalId);
        return isApproved(proposal.getYesCount(), proposal.getNoCount());
    }

    static boolean isApproved(long yesCount, long noCount) {
        return yesCount > noCount;
    }
}
