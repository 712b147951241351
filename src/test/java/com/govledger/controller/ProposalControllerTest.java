package com.govledger.controller;

import com.govledger.domain.Proposal;
import com.govledger.domain.ProposalInfo;
import com.govledger.domain.VotePercentages;
import com.govledger.exception.DuplicateVoteException;
import com.govledger.exception.InvalidInputException;
import com.govledger.exception.ProposalAlreadyClosedException;
import com.govledger.exception.ProposalInactiveException;
import com.govledger.exception.ProposalNotFoundException;
import com.govledger.exception.UnauthorizedCallerException;
import com.govledger.service.ProposalService;
import com.govledger.service.TallyService;
import com.govledger.service.VoteService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Controller slice tests - HTTP contract verification.
 * No database. No full Spring context.
 */
@WebMvcTest(ProposalController.class)
class ProposalControllerTest {

    private static final String ADMIN = "0xadmin";

    @Autowired MockMvc mockMvc;

    @MockBean ProposalService proposalService;
    @MockBean VoteService     voteService;
    @MockBean TallyService    tallyService;

    // ── create ────────────────────────────────────────────────────────────────

    @Test @WithMockUser(username = ADMIN) @DisplayName("POST /proposals by administrator → 201 with id")
    void createProposal() throws Exception {
        when(proposalService.create("A", "desc", ADMIN)).thenReturn(0L);

        mockMvc.perform(post("/proposals").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"A\",\"description\":\"desc\"}"))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.proposalId").value(0));
    }

    @Test @WithMockUser(username = ADMIN) @DisplayName("POST /proposals with empty title → 400 field map")
    void createEmptyTitle() throws Exception {
        mockMvc.perform(post("/proposals").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"\",\"description\":\"desc\"}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.title").exists());

        verifyNoInteractions(proposalService);
    }

    @Test @WithMockUser(username = ADMIN) @DisplayName("service InvalidInput → 400 INVALID_INPUT")
    void createInvalidInput() throws Exception {
        when(proposalService.create(anyString(), anyString(), eq(ADMIN)))
            .thenThrow(new InvalidInputException("Description cannot be empty"));

        mockMvc.perform(post("/proposals").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"A\",\"description\":\"d\"}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test @WithMockUser(username = "0xoutsider") @DisplayName("POST /proposals by non-administrator → 403 UNAUTHORIZED")
    void createUnauthorized() throws Exception {
        when(proposalService.create(anyString(), anyString(), eq("0xoutsider")))
            .thenThrow(new UnauthorizedCallerException("0xoutsider", "create proposals"));

        mockMvc.perform(post("/proposals").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"A\",\"description\":\"desc\"}"))
               .andExpect(status().isForbidden())
               .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test @DisplayName("POST /proposals without authentication → rejected, service untouched")
    void createAnonymous() throws Exception {
        mockMvc.perform(post("/proposals").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"A\",\"description\":\"desc\"}"))
               .andExpect(status().is4xxClientError());

        verifyNoInteractions(proposalService);
    }

    @Test @WithMockUser(username = ADMIN) @DisplayName("malformed JSON → 400 INVALID_INPUT")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/proposals").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    // ── vote ──────────────────────────────────────────────────────────────────

    @Test @WithMockUser(username = "0xvoter") @DisplayName("POST /proposals/0/votes → 200 with updated tally, voter from principal")
    void castVote() throws Exception {
        when(proposalService.getProposalInfo(0L)).thenReturn(new ProposalInfo("A", "desc", 1, 0, true));

        mockMvc.perform(post("/proposals/0/votes").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":true}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.proposalId").value(0))
               .andExpect(jsonPath("$.yesCount").value(1))
               .andExpect(jsonPath("$.noCount").value(0))
               .andExpect(jsonPath("$.active").value(true));

        verify(voteService).castVote(0L, "0xvoter", true);
    }

    @Test @WithMockUser(username = "0xvoter") @DisplayName("vote without support flag → 400")
    void castVoteMissingSupport() throws Exception {
        mockMvc.perform(post("/proposals/0/votes").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.support").exists());

        verifyNoInteractions(voteService);
    }

    @Test @WithMockUser(username = "0xvoter") @DisplayName("second vote → 409 DUPLICATE_VOTE")
    void duplicateVote() throws Exception {
        doThrow(new DuplicateVoteException(0, "0xvoter")).when(voteService).castVote(0L, "0xvoter", false);

        mockMvc.perform(post("/proposals/0/votes").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":false}"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("DUPLICATE_VOTE"));
    }

    @Test @WithMockUser(username = "0xvoter") @DisplayName("unique-constraint race on vote → 409 DUPLICATE_VOTE")
    void duplicateVoteRace() throws Exception {
        doThrow(new DataIntegrityViolationException("uk_vote_records_proposal_voter"))
            .when(voteService).castVote(0L, "0xvoter", true);

        mockMvc.perform(post("/proposals/0/votes").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":true}"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("DUPLICATE_VOTE"));
    }

    @Test @WithMockUser(username = "0xvoter") @DisplayName("vote on closed proposal → 409 INACTIVE")
    void inactiveVote() throws Exception {
        doThrow(new ProposalInactiveException(0)).when(voteService).castVote(0L, "0xvoter", true);

        mockMvc.perform(post("/proposals/0/votes").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":true}"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("INACTIVE"));
    }

    @Test @WithMockUser(username = "0xvoter") @DisplayName("vote on unknown proposal → 404 NOT_FOUND")
    void unknownVote() throws Exception {
        doThrow(new ProposalNotFoundException(5)).when(voteService).castVote(5L, "0xvoter", true);

        mockMvc.perform(post("/proposals/5/votes").with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":true}"))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    // ── close ─────────────────────────────────────────────────────────────────

    @Test @WithMockUser(username = ADMIN) @DisplayName("POST /proposals/0/close → 200 with final tally")
    void closeProposal() throws Exception {
        when(proposalService.getProposalInfo(0L)).thenReturn(new ProposalInfo("A", "desc", 1, 1, false));

        mockMvc.perform(post("/proposals/0/close").with(csrf()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.active").value(false));

        verify(proposalService).close(0L, ADMIN);
    }

    @Test @WithMockUser(username = ADMIN) @DisplayName("close twice → 409 ALREADY_CLOSED")
    void closeTwice() throws Exception {
        doThrow(new ProposalAlreadyClosedException(0)).when(proposalService).close(0L, ADMIN);

        mockMvc.perform(post("/proposals/0/close").with(csrf()))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("ALREADY_CLOSED"));
    }

    // ── queries ───────────────────────────────────────────────────────────────

    @Test @WithMockUser @DisplayName("GET /proposals → all ids")
    void allIds() throws Exception {
        when(proposalService.getAllProposalIds()).thenReturn(List.of(0L, 1L, 2L));

        mockMvc.perform(get("/proposals"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.length()").value(3))
               .andExpect(jsonPath("$[2]").value(2));
    }

    @Test @WithMockUser @DisplayName("GET /proposals/active → active ids only")
    void activeIds() throws Exception {
        when(proposalService.getActiveProposalIds()).thenReturn(List.of(1L));

        mockMvc.perform(get("/proposals/active"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$[0]").value(1));
    }

    @Test @WithMockUser @DisplayName("GET /proposals/{id} unknown → 404")
    void infoNotFound() throws Exception {
        when(proposalService.getProposalInfo(99L)).thenThrow(new ProposalNotFoundException(99));

        mockMvc.perform(get("/proposals/99"))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test @WithMockUser @DisplayName("GET /proposals/abc → 400 INVALID_INPUT")
    void nonNumericId() throws Exception {
        mockMvc.perform(get("/proposals/abc"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test @WithMockUser @DisplayName("GET /proposals/0/details → creator, epoch-second timestamp, voter count")
    void details() throws Exception {
        Proposal proposal = new Proposal(0L, "A", "desc", ADMIN, Instant.ofEpochSecond(1_714_564_800L));
        proposal.recordVote(true);
        when(proposalService.getProposal(0L)).thenReturn(proposal);
        when(voteService.countVoters(0L)).thenReturn(1L);

        mockMvc.perform(get("/proposals/0/details"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.creator").value(ADMIN))
               .andExpect(jsonPath("$.createdAt").value(1_714_564_800L))
               .andExpect(jsonPath("$.yesCount").value(1))
               .andExpect(jsonPath("$.voterCount").value(1));
    }

    @Test @WithMockUser @DisplayName("GET /proposals/0/percentages → basis points")
    void percentages() throws Exception {
        when(tallyService.getVotePercentages(0L)).thenReturn(new VotePercentages(3333, 6666));

        mockMvc.perform(get("/proposals/0/percentages"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.yesPct").value(3333))
               .andExpect(jsonPath("$.noPct").value(6666));
    }

    @Test @WithMockUser @DisplayName("GET /proposals/0/result → approved flag")
    void result() throws Exception {
        when(tallyService.getProposalResult(0L)).thenReturn(false);

        mockMvc.perform(get("/proposals/0/result"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.approved").value(false));
    }

    @Test @WithMockUser @DisplayName("GET /proposals/0/votes/{voter} → hasVoted flag")
    void hasVoted() throws Exception {
        when(voteService.hasVoted(0L, "0xvoter")).thenReturn(true);

        mockMvc.perform(get("/proposals/0/votes/0xvoter"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.voter").value("0xvoter"))
               .andExpect(jsonPath("$.hasVoted").value(true));
    }
}
