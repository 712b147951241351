package com.govledger.controller;

import com.govledger.domain.Proposal;
import com.govledger.dto.ApiResponses;
import com.govledger.dto.CastVoteRequest;
import com.govledger.dto.CreateProposalRequest;
import com.govledger.security.AuthenticatedCaller;
import com.govledger.service.ProposalService;
import com.govledger.service.TallyService;
import com.govledger.service.VoteService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for proposals, votes and tallies.
 *
 * RULES:
 * - No business logic: pure delegation to ProposalService, VoteService and TallyService
 * - The caller identity always comes from the authenticated principal, never the body
 *
 * HTTP CONTRACT SUMMARY:
 * POST   /proposals                         → 201 | 400 | 403
 * GET    /proposals                         → 200 (all ids, ascending)
 * GET    /proposals/active                  → 200 (active ids, ascending)
 * GET    /proposals/{id}                    → 200 | 404
 * GET    /proposals/{id}/details            → 200 | 404
 * GET    /proposals/{id}/percentages        → 200 | 404
 * GET    /proposals/{id}/result             → 200 | 404
 * POST   /proposals/{id}/votes              → 200 | 404 | 409 (INACTIVE / DUPLICATE_VOTE)
 * GET    /proposals/{id}/votes/{voter}      → 200 | 404
 * POST   /proposals/{id}/close              → 200 | 403 | 404 | 409 (ALREADY_CLOSED)
 */
@RestController
@RequestMapping("/proposals")
@Tag(name = "Proposals", description = "Proposal lifecycle, voting and tallies")
public class ProposalController {

    private final ProposalService proposalService;
    private final VoteService voteService;
    private final TallyService tallyService;

    public ProposalController(ProposalService proposalService,
                              VoteService voteService,
                              TallyService tallyService) {
        this.proposalService = proposalService;
        this.voteService = voteService;
        this.tallyService = tallyService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READ
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping
    @Operation(summary = "List proposal ids", description = "All proposal ids ever created, 0..count-1")
    public ResponseEntity<List<Long>> getAllProposalIds() {
        return ResponseEntity.ok(proposalService.getAllProposalIds());
    }

    @GetMapping("/active")
    @Operation(summary = "List active proposal ids", description = "Ids of proposals still accepting votes, ascending")
    public ResponseEntity<List<Long>> getActiveProposalIds() {
        return ResponseEntity.ok(proposalService.getActiveProposalIds());
    }

    @GetMapping("/{proposalId}")
    @Operation(summary = "Get proposal", description = "Title, description, tallies and active flag")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Proposal found"),
        @ApiResponse(responseCode = "404", description = "No proposal with this id")
    })
    public ResponseEntity<ApiResponses.ProposalInfoResponse> getProposalInfo(
            @Parameter(description = "Proposal ID") @PathVariable long proposalId) {
        return ResponseEntity.ok(new ApiResponses.ProposalInfoResponse(
                proposalId, proposalService.getProposalInfo(proposalId)));
    }

    @GetMapping("/{proposalId}/details")
    @Operation(summary = "Get proposal details", description = "Adds creator, creation time and voter count")
    public ResponseEntity<ApiResponses.ProposalDetailsResponse> getProposalDetails(
            @Parameter(description = "Proposal ID") @PathVariable long proposalId) {
        Proposal proposal = proposalService.getProposal(proposalId);
        long voterCount = voteService.countVoters(proposalId);
        return ResponseEntity.ok(new ApiResponses.ProposalDetailsResponse(proposal, voterCount));
    }

    @GetMapping("/{proposalId}/percentages")
    @Operation(summary = "Get vote percentages",
               description = "Yes/no shares scaled by 10000 (10000 = 100.00%), floored; (0, 0) with no votes")
    public ResponseEntity<ApiResponses.VotePercentagesResponse> getVotePercentages(
            @Parameter(description = "Proposal ID") @PathVariable long proposalId) {
        return ResponseEntity.ok(new ApiResponses.VotePercentagesResponse(
                proposalId, tallyService.getVotePercentages(proposalId)));
    }

    @GetMapping("/{proposalId}/result")
    @Operation(summary = "Get proposal result", description = "Approved iff yes > no; a tie is not approved")
    public ResponseEntity<ApiResponses.ProposalResultResponse> getProposalResult(
            @Parameter(description = "Proposal ID") @PathVariable long proposalId) {
        return ResponseEntity.ok(new ApiResponses.ProposalResultResponse(
                proposalId, tallyService.getProposalResult(proposalId)));
    }

    @GetMapping("/{proposalId}/votes/{voter}")
    @Operation(summary = "Has voted", description = "Whether an address has voted on the proposal")
    public ResponseEntity<ApiResponses.HasVotedResponse> hasVoted(
            @Parameter(description = "Proposal ID") @PathVariable long proposalId,
            @Parameter(description = "Voter address") @PathVariable String voter) {
        return ResponseEntity.ok(new ApiResponses.HasVotedResponse(
                proposalId, voter, voteService.hasVoted(proposalId, voter)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // MUTATIONS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Create a proposal. Administrator only.
     *
     * HTTP Contract:
     * - 201 Created     → proposal stored, body carries the new id
     * - 400 Bad Request → empty title or description
     * - 403 Forbidden   → caller is not the administrator
     */
    @PostMapping
    @Operation(summary = "Create proposal", description = "Administrator only")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Proposal created"),
        @ApiResponse(responseCode = "400", description = "Empty title or description"),
        @ApiResponse(responseCode = "403", description = "Caller is not the administrator")
    })
    public ResponseEntity<ApiResponses.ProposalCreatedResponse> create(
            @Valid @RequestBody CreateProposalRequest request,
            Authentication authentication) {

        long proposalId = proposalService.create(
                request.getTitle(),
                request.getDescription(),
                AuthenticatedCaller.addressOf(authentication));

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new ApiResponses.ProposalCreatedResponse(proposalId));
    }

    /**
     * Cast a vote as the authenticated caller.
     *
     * HTTP Contract:
     * - 200 OK        → vote counted, body carries the updated tally
     * - 404 Not Found → no proposal with this id
     * - 409 Conflict  → proposal closed (INACTIVE) or caller already voted (DUPLICATE_VOTE)
     */
    @PostMapping("/{proposalId}/votes")
    @Operation(summary = "Cast vote", description = "One vote per address per proposal; votes are final")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Vote counted"),
        @ApiResponse(responseCode = "404", description = "Proposal not found"),
        @ApiResponse(responseCode = "409", description = "Proposal closed or address already voted")
    })
    public ResponseEntity<ApiResponses.ProposalInfoResponse> castVote(
            @Parameter(description = "Proposal ID") @PathVariable long proposalId,
            @Valid @RequestBody CastVoteRequest request,
            Authentication authentication) {

        voteService.castVote(proposalId, AuthenticatedCaller.addressOf(authentication), request.getSupport());

        return ResponseEntity.ok(new ApiResponses.ProposalInfoResponse(
                proposalId, proposalService.getProposalInfo(proposalId)));
    }

    /**
     * Close a proposal permanently. Administrator only.
     *
     * HTTP Contract:
     * - 200 OK        → proposal closed, body carries the final tally
     * - 403 Forbidden → caller is not the administrator
     * - 404 Not Found → no proposal with this id
     * - 409 Conflict  → already closed (ALREADY_CLOSED)
     */
    @PostMapping("/{proposalId}/close")
    @Operation(summary = "Close proposal", description = "Administrator only; closing is permanent")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Proposal closed"),
        @ApiResponse(responseCode = "403", description = "Caller is not the administrator"),
        @ApiResponse(responseCode = "404", description = "Proposal not found"),
        @ApiResponse(responseCode = "409", description = "Proposal already closed")
    })
    public ResponseEntity<ApiResponses.ProposalInfoResponse> close(
            @Parameter(description = "Proposal ID") @PathVariable long proposalId,
            Authentication authentication) {

        proposalService.close(proposalId, AuthenticatedCaller.addressOf(authentication));

        return ResponseEntity.ok(new ApiResponses.ProposalInfoResponse(
                proposalId, proposalService.getProposalInfo(proposalId)));
    }
}
