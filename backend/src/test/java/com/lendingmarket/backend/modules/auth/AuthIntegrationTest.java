package com.lendingmarket.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserStatus;
import com.lendingmarket.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.lendingmarket.backend.support.AbstractPostgresIntegrationTest;
import com.lendingmarket.backend.support.TestUserFactory;

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
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String EMAIL = "dana@example.com";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserAccountRepository userAccountRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @BeforeEach
    void setUp() {
        testUserFactory.ensureUser(EMAIL, "Dana", Capability.BORROWER);
    }

    @Test
    void loginReturnsTokenAndProfile() throws Exception {
        JsonNode response = login(EMAIL);

        assertThat(response.path("tokens").path("accessToken").asText()).isNotBlank();
        assertThat(response.path("user").path("capabilities"))
                .as("registered users borrow by default")
                .anyMatch(node -> node.asText().equals("BORROWER"));
        assertThat(response.path("user").path("isLender").asBoolean()).isFalse();
    }

    @Test
    void loginIgnoresEmailCase() throws Exception {
        JsonNode response = login("DANA@Example.COM");

        assertThat(response.path("user").path("email").asText()).isEqualTo(EMAIL);
    }

    @Test
    void wrongPasswordIsRejected() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "Wrong1234"}
                                """.formatted(EMAIL)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("INVALID_CREDENTIALS"));
    }

    @Test
    void canFetchProfileWithIssuedAccessToken() throws Exception {
        String accessToken = login(EMAIL).path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/user/profile").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.isBorrower").value(true))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void weakPasswordFailsRegistration() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "weak@example.com", "name": "Weak", "password": "short"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.password").exists());

        assertThat(userAccountRepository.findByEmailIgnoreCase("weak@example.com")).isEmpty();
    }

    @Test
    void deactivatedUserCannotLogIn() throws Exception {
        String accessToken = login(EMAIL).path("tokens").path("accessToken").asText();

        mockMvc.perform(delete("/user/profile").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isNoContent());

        assertThat(userAccountRepository.findByEmailIgnoreCase(EMAIL))
                .hasValueSatisfying(user -> {
                    assertThat(user.getStatus()).isEqualTo(UserStatus.INACTIVE);
                    assertThat(user.getDeactivatedAt()).isNotNull();
                });

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "%s"}
                                """.formatted(EMAIL, TestUserFactory.DEFAULT_PASSWORD)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("USER_INACTIVE"));
    }

    private JsonNode login(String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "%s"}
                                """.formatted(email, TestUserFactory.DEFAULT_PASSWORD)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
