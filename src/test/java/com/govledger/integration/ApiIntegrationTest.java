package com.govledger.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end API test.
 * Walks the full governance workflow: register → login → propose → vote → tally → close.
 *
 * Uses @SpringBootTest with the full application context and real transaction management.
 * Uses H2 in-memory database (configured in application-test.yml); "0xadmin" is the
 * configured initial administrator.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ApiIntegrationTest {

    private static final String ADMIN = "0xadmin";
    private static final String VOTER_X = "0xvoterx";
    private static final String VOTER_Y = "0xvotery";
    private static final String VOTER_Z = "0xvoterz";
    private static final String PASSWORD = "Password123!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    // State shared across test methods (executed in order)
    private static String adminToken;
    private static String xToken;
    private static String yToken;
    private static String zToken;

    private static String register(String address) {
        return "{\"address\":\"" + address + "\",\"password\":\"" + PASSWORD + "\"}";
    }

    private String login(String address) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(register(address)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").exists())
                .andExpect(jsonPath("$.address").value(address))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("token").asText();
    }

    private void vote(String token, boolean support, int expectedStatus) throws Exception {
        mockMvc.perform(post("/proposals/0/votes")
                .header("Authorization", "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":" + support + "}"))
                .andExpect(status().is(expectedStatus));
    }

    // ── 1. Members ────────────────────────────────────────────────────────────

    @Test
    @Order(1)
    @DisplayName("GET /governance - initial administrator, no proposals")
    void initialState() throws Exception {
        mockMvc.perform(get("/governance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.administrator").value(ADMIN))
                .andExpect(jsonPath("$.proposalCount").value(0));

        mockMvc.perform(get("/proposals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @Order(2)
    @DisplayName("POST /members/register - administrator and three voters")
    void registerMembers() throws Exception {
        for (String address : new String[] {ADMIN, VOTER_X, VOTER_Y, VOTER_Z}) {
            mockMvc.perform(post("/members/register")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(register(address)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.memberId").exists())
                    .andExpect(jsonPath("$.address").value(address));
        }
    }

    @Test
    @Order(3)
    @DisplayName("POST /members/register - duplicate address rejected")
    void registerDuplicate() throws Exception {
        mockMvc.perform(post("/members/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(register(VOTER_X)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.message").value(containsString("already registered")));
    }

    @Test
    @Order(10)
    @DisplayName("POST /auth/login - every member gets a token")
    void loginAll() throws Exception {
        adminToken = login(ADMIN);
        xToken = login(VOTER_X);
        yToken = login(VOTER_Y);
        zToken = login(VOTER_Z);
    }

    @Test
    @Order(11)
    @DisplayName("POST /auth/login - wrong password rejected with 401")
    void loginWrongPassword() throws Exception {
        mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"address\":\"" + VOTER_X + "\",\"password\":\"WrongPassword!\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid address or password"));
    }

    // ── 2. Proposal lifecycle ─────────────────────────────────────────────────

    @Test
    @Order(20)
    @DisplayName("POST /proposals - without token returns 401")
    void createUnauthenticated() throws Exception {
        mockMvc.perform(post("/proposals")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"A\",\"description\":\"desc\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @Order(21)
    @DisplayName("POST /proposals - non-administrator returns 403, count unchanged")
    void createByVoter() throws Exception {
        mockMvc.perform(post("/proposals")
                .header("Authorization", "Bearer " + xToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"A\",\"description\":\"desc\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        mockMvc.perform(get("/governance"))
                .andExpect(jsonPath("$.proposalCount").value(0));
    }

    @Test
    @Order(22)
    @DisplayName("POST /proposals - administrator creates proposal 0")
    void createFirst() throws Exception {
        mockMvc.perform(post("/proposals")
                .header("Authorization", "Bearer " + adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"A\",\"description\":\"desc\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.proposalId").value(0));

        mockMvc.perform(get("/proposals/0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("A"))
                .andExpect(jsonPath("$.description").value("desc"))
                .andExpect(jsonPath("$.yesCount").value(0))
                .andExpect(jsonPath("$.noCount").value(0))
                .andExpect(jsonPath("$.active").value(true));

        mockMvc.perform(get("/proposals/0/percentages"))
                .andExpect(jsonPath("$.yesPct").value(0))
                .andExpect(jsonPath("$.noPct").value(0));
    }

    @Test
    @Order(23)
    @DisplayName("X votes yes; second vote by X is a duplicate")
    void voteX() throws Exception {
        vote(xToken, true, 200);

        mockMvc.perform(get("/proposals/0"))
                .andExpect(jsonPath("$.yesCount").value(1));

        mockMvc.perform(post("/proposals/0/votes")
                .header("Authorization", "Bearer " + xToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":false}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_VOTE"));

        mockMvc.perform(get("/proposals/0"))
                .andExpect(jsonPath("$.yesCount").value(1))
                .andExpect(jsonPath("$.noCount").value(0));
    }

    @Test
    @Order(24)
    @DisplayName("Y votes no → 5000/5000, tie is not approved")
    void voteY() throws Exception {
        vote(yToken, false, 200);

        mockMvc.perform(get("/proposals/0"))
                .andExpect(jsonPath("$.noCount").value(1));

        mockMvc.perform(get("/proposals/0/percentages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.yesPct").value(5000))
                .andExpect(jsonPath("$.noPct").value(5000));

        mockMvc.perform(get("/proposals/0/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved").value(false));

        mockMvc.perform(get("/proposals/0/votes/" + VOTER_Y))
                .andExpect(jsonPath("$.hasVoted").value(true));
        mockMvc.perform(get("/proposals/0/votes/" + VOTER_Z))
                .andExpect(jsonPath("$.hasVoted").value(false));
    }

    @Test
    @Order(25)
    @DisplayName("X cannot close; administrator closes")
    void close() throws Exception {
        mockMvc.perform(post("/proposals/0/close")
                .header("Authorization", "Bearer " + xToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        mockMvc.perform(post("/proposals/0/close")
                .header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false))
                .andExpect(jsonPath("$.yesCount").value(1))
                .andExpect(jsonPath("$.noCount").value(1));
    }

    @Test
    @Order(26)
    @DisplayName("Z votes after close → INACTIVE; second close → ALREADY_CLOSED")
    void afterClose() throws Exception {
        mockMvc.perform(post("/proposals/0/votes")
                .header("Authorization", "Bearer " + zToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INACTIVE"));

        mockMvc.perform(post("/proposals/0/close")
                .header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_CLOSED"));

        mockMvc.perform(get("/proposals/0/votes/" + VOTER_Z))
                .andExpect(jsonPath("$.hasVoted").value(false));
    }

    @Test
    @Order(27)
    @DisplayName("GET /proposals/{id} - unknown id returns 404")
    void unknownProposal() throws Exception {
        mockMvc.perform(get("/proposals/1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));

        mockMvc.perform(post("/proposals/1/votes")
                .header("Authorization", "Bearer " + zToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":true}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @Order(28)
    @DisplayName("GET /events - created, two votes, closed, in order")
    void events() throws Exception {
        mockMvc.perform(get("/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(4))
                .andExpect(jsonPath("$[0].kind").value("ProposalCreated"))
                .andExpect(jsonPath("$[0].payload.creator").value(ADMIN))
                .andExpect(jsonPath("$[1].kind").value("Voted"))
                .andExpect(jsonPath("$[1].payload.voter").value(VOTER_X))
                .andExpect(jsonPath("$[1].payload.support").value(true))
                .andExpect(jsonPath("$[2].payload.voter").value(VOTER_Y))
                .andExpect(jsonPath("$[2].payload.support").value(false))
                .andExpect(jsonPath("$[3].kind").value("ProposalClosed"))
                .andExpect(jsonPath("$[3].payload.yesCount").value(1))
                .andExpect(jsonPath("$[3].payload.noCount").value(1));
    }

    // ── 3. Id listings ────────────────────────────────────────────────────────

    @Test
    @Order(30)
    @DisplayName("GET /proposals and /proposals/active after a second proposal")
    void listings() throws Exception {
        mockMvc.perform(post("/proposals")
                .header("Authorization", "Bearer " + adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"B\",\"description\":\"second\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.proposalId").value(1));

        mockMvc.perform(get("/proposals"))
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0]").value(0))
                .andExpect(jsonPath("$[1]").value(1));

        mockMvc.perform(get("/proposals/active"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0]").value(1));

        mockMvc.perform(get("/proposals/1/details"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.creator").value(ADMIN))
                .andExpect(jsonPath("$.voterCount").value(0));
    }

    // ── 4. Administrator transfer ─────────────────────────────────────────────

    @Test
    @Order(40)
    @DisplayName("Transfer administrator to X: old administrator loses rights immediately")
    void transfer() throws Exception {
        mockMvc.perform(post("/governance/administrator")
                .header("Authorization", "Bearer " + yToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"newAdministrator\":\"" + VOTER_Y + "\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/governance/administrator")
                .header("Authorization", "Bearer " + adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"newAdministrator\":\"" + VOTER_X + "\"}"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/governance"))
                .andExpect(jsonPath("$.administrator").value(VOTER_X))
                .andExpect(jsonPath("$.proposalCount").value(2));

        mockMvc.perform(post("/proposals/1/close")
                .header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/proposals/1/close")
                .header("Authorization", "Bearer " + xToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
    }

    @Test
    @Order(41)
    @DisplayName("Transfer back to the original administrator")
    void transferBack() throws Exception {
        mockMvc.perform(post("/governance/administrator")
                .header("Authorization", "Bearer " + xToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"newAdministrator\":\"" + ADMIN + "\"}"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/governance"))
                .andExpect(jsonPath("$.administrator").value(ADMIN));

        mockMvc.perform(get("/proposals/active"))
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @Order(42)
    @DisplayName("Transfer to an over-long address → 400, administrator unchanged")
    void transferTooLong() throws Exception {
        String target = "0x" + "f".repeat(140);

        mockMvc.perform(post("/governance/administrator")
                .header("Authorization", "Bearer " + adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"newAdministrator\":\"" + target + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.newAdministrator").exists());

        mockMvc.perform(get("/governance"))
                .andExpect(jsonPath("$.administrator").value(ADMIN));
    }
}
