package com.teamstash.backend.modules.team;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamstash.backend.support.AbstractPostgresIntegrationTest;
import com.teamstash.backend.support.TestTokens;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class ActiveTeamIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String COOKIE = "active_team_id";
    private static final UUID ALICE_ID = UUID.fromString("00000000-0000-0000-0000-00000000b001");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestTokens testTokens;

    private String alice;

    @BeforeEach
    void setUp() {
        alice = testTokens.bearer(testTokens.verified(ALICE_ID, "alice@example.com"));
    }

    @Test
    void principalWithoutTeamsMustOnboard() throws Exception {
        MvcResult result = mockMvc.perform(get("/items")
                        .header("Authorization", alice)
                        .cookie(new Cookie(COOKIE, UUID.randomUUID().toString())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("team.onboarding_required"))
                .andReturn();

        Cookie cleared = result.getResponse().getCookie(COOKIE);
        assertThat(cleared).isNotNull();
        assertThat(cleared.getMaxAge()).isZero();
    }

    @Test
    void stalePreferenceFallsBackToOldestTeamAndIsRewritten() throws Exception {
        UUID home = createTeam("Home");
        createTeam("Office");

        MvcResult result = mockMvc.perform(get("/teams/active")
                        .header("Authorization", alice)
                        .cookie(new Cookie(COOKIE, UUID.randomUUID().toString())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.teamId").value(home.toString()))
                .andExpect(jsonPath("$.role").value("ADMIN"))
                .andReturn();

        Cookie rewritten = result.getResponse().getCookie(COOKIE);
        assertThat(rewritten).isNotNull();
        assertThat(rewritten.getValue()).isEqualTo(home.toString());
    }

    @Test
    void explicitSelectionIsHonouredOnLaterRequests() throws Exception {
        createTeam("Home");
        UUID office = createTeam("Office");

        MvcResult selection = mockMvc.perform(put("/teams/active")
                        .header("Authorization", alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teamId\":\"" + office + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        Cookie preference = selection.getResponse().getCookie(COOKIE);
        assertThat(preference).isNotNull();

        MvcResult result = mockMvc.perform(get("/teams/active")
                        .header("Authorization", alice)
                        .cookie(new Cookie(COOKIE, preference.getValue())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.teamId").value(office.toString()))
                .andReturn();
        assertThat(result.getResponse().getCookie(COOKIE)).isNull();
    }

    @Test
    void selectingForeignTeamIsForbidden() throws Exception {
        createTeam("Home");

        mockMvc.perform(put("/teams/active")
                        .header("Authorization", alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teamId\":\"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("team.forbidden"));
    }

    @Test
    void duplicateTeamNameForSameOwnerIsConflict() throws Exception {
        createTeam("Groceries");

        mockMvc.perform(post("/teams")
                        .header("Authorization", alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"GROCERIES\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("team.name_conflict"))
                .andExpect(jsonPath("$.rejected.name").value("GROCERIES"));
    }

    @Test
    void requestWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/teams"))
                .andExpect(status().isUnauthorized());
    }

    private UUID createTeam(String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/teams")
                        .header("Authorization", alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + name + "\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        return UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString()).path("teamId").asText());
    }
}
