package com.teamcode.backend.controller;

import com.teamcode.backend.auth.AuthPrincipal;
import com.teamcode.backend.dto.EligibilityDto;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.service.AnswerEligibilityService;
import com.teamcode.backend.service.AnswerService;
import com.teamcode.backend.service.AnswerTestCaseResultService;
import com.teamcode.backend.util.JwtProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnswerController.class)
@AutoConfigureMockMvc
class AnswerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JwtProvider jwtProvider;

    @MockBean
    private AnswerService answerService;

    @MockBean
    private AnswerEligibilityService answerEligibilityService;

    @MockBean
    private AnswerTestCaseResultService answerTestCaseResultService;

    private static RequestPostProcessor signedIn(long userId) {
        var authorities = List.of(new SimpleGrantedAuthority("ROLE_USER"));
        var principal = new AuthPrincipal(userId, "user" + userId + "@example.com", authorities);
        return authentication(new UsernamePasswordAuthenticationToken(principal, null, authorities));
    }

    @Test
    void eligibilityUsesSnakeCaseKeys() throws Exception {
        given(answerEligibilityService.eligibility(5L, 3L, 7L))
                .willReturn(new EligibilityDto(3L, 7L, true, false, false));

        mockMvc.perform(get("/api/teams/3/questions/7/eligibility").with(signedIn(5L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.team_id").value(3))
                .andExpect(jsonPath("$.or_dependencies_completed").value(true))
                .andExpect(jsonPath("$.and_dependencies_completed").value(false))
                .andExpect(jsonPath("$.able_to_answer").value(false));
    }

    @Test
    void unknownTeamIsNotFound() throws Exception {
        given(answerEligibilityService.eligibility(5L, 99L, 7L))
                .willThrow(new BizException("TEAM_NOT_FOUND", "Team not found: 99"));

        mockMvc.perform(get("/api/teams/99/questions/7/eligibility").with(signedIn(5L)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TEAM_NOT_FOUND"));
    }

    @Test
    void outsiderIsForbidden() throws Exception {
        given(answerEligibilityService.eligibility(8L, 3L, 7L))
                .willThrow(new BizException("NOT_TEAM_MEMBER", "User does not belong to team 3"));

        mockMvc.perform(get("/api/teams/3/questions/7/eligibility").with(signedIn(8L)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_TEAM_MEMBER"));
    }
}
