package com.lendingmarket.backend.modules.loan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingmarket.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.invitation.domain.EmailInvitation;
import com.lendingmarket.backend.modules.invitation.domain.EmailInvitationStatus;
import com.lendingmarket.backend.modules.invitation.infrastructure.persistence.EmailInvitationRepository;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanParticipantRepository;
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
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.ResultMatcher;

@SpringBootTest
@AutoConfigureMockMvc
class LoanIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String VALID_ACH = """
            {
              "bankName": "First Bank",
              "accountType": "checking",
              "routingNumber": "123456789",
              "accountNumber": "00012345"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private LoanParticipantRepository loanParticipantRepository;

    @Autowired
    private EmailInvitationRepository emailInvitationRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    private UserAccount borrower;
    private String borrowerToken;

    @BeforeEach
    void setUp() {
        borrower = testUserFactory.ensureUser("borrower@example.com", "Bea Borrower", Capability.BORROWER);
        borrowerToken = testUserFactory.bearer(borrower);
    }

    @Test
    void fundAndRepayLoanEndToEnd() throws Exception {
        UserAccount lender = testUserFactory.ensureUser("lender@example.com", "Len Lender", Capability.BORROWER);
        String lenderToken = testUserFactory.bearer(lender);

        UUID loanId = createLoan("10000");
        JsonNode invited = inviteLender(loanId, "lender@example.com", "10000")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.invitedCount").value(1))
                .andReturnJson();
        assertThat(invited.path("totalInvited").decimalValue()).isEqualByComparingTo("10000");
        UUID participantId = UUID.fromString(invited.path("participants").get(0).path("participantId").asText());

        mockMvc.perform(get("/lender/pending").header("Authorization", lenderToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].loanId").value(loanId.toString()));

        mockMvc.perform(put("/lender/accept/{loanId}", loanId)
                        .header("Authorization", lenderToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_ACH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.participantStatus").value("ACCEPTED"))
                .andExpect(jsonPath("$.loanStatus").value("ACTIVE"))
                .andExpect(jsonPath("$.isFullyFunded").value(true));

        JsonNode submitted = json(mockMvc.perform(post("/repayments")
                        .header("Authorization", borrowerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "loanId": "%s",
                                  "participantId": "%s",
                                  "amount": 500,
                                  "paymentDate": "%s"
                                }
                                """.formatted(loanId, participantId, LocalDate.now(ZoneOffset.UTC))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andReturn());
        String repaymentId = submitted.path("repaymentId").asText();

        mockMvc.perform(get("/repayments/pending").header("Authorization", lenderToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].repaymentId").value(repaymentId));

        JsonNode approved = json(mockMvc.perform(put("/repayments/{id}", repaymentId)
                        .header("Authorization", lenderToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"decision": "APPROVED"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andReturn());
        assertThat(approved.path("participantRemainingBalance").decimalValue()).isEqualByComparingTo("9500");

        LoanParticipant participant = loanParticipantRepository.findById(participantId).orElseThrow();
        assertThat(participant.getRemainingBalance()).isEqualByComparingTo("9500");
        assertThat(participant.getTotalRepaid()).isEqualByComparingTo("500");

        mockMvc.perform(put("/repayments/{id}", repaymentId)
                        .header("Authorization", lenderToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"decision": "APPROVED"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_REVIEWED"));

        mockMvc.perform(get("/loans/{loanId}", loanId).header("Authorization", lenderToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.viewerRole").value("LENDER"))
                .andExpect(jsonPath("$.participants.length()").value(1))
                .andExpect(jsonPath("$.participants[0].achDetails.routingNumber").value("123456789"));

        mockMvc.perform(get("/user/lender-portfolio").header("Authorization", lenderToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1))
                .andExpect(jsonPath("$.portfolio[0].loanId").value(loanId.toString()))
                .andExpect(jsonPath("$.portfolio[0].participationStatus").value("ACCEPTED"))
                .andExpect(jsonPath("$.portfolio[0].borrowerName").value("Bea Borrower"))
                .andExpect(jsonPath("$.summary.activeInvestments").value(1));

        mockMvc.perform(get("/user/lender-portfolio").header("Authorization", borrowerToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_ROLE"));

        assertThat(auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc("LOAN", loanId.toString()))
                .extracting("actionType")
                .containsExactly("LOAN_CREATED", "LENDERS_INVITED");
    }

    @Test
    void overInvitingIsRejectedWithoutSideEffects() throws Exception {
        UUID loanId = createLoan("10000");
        inviteLender(loanId, "a@example.com", "6000").andExpect(status().isCreated());
        long participantsBefore = loanParticipantRepository.count();
        long invitationsBefore = emailInvitationRepository.count();

        inviteLender(loanId, "b@example.com", "4000.01")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVALID_AMOUNT"))
                .andExpect(jsonPath("$.path").value("/loans/" + loanId + "/invitations"));

        assertThat(loanParticipantRepository.count()).isEqualTo(participantsBefore);
        assertThat(emailInvitationRepository.count()).isEqualTo(invitationsBefore);
    }

    @Test
    void registeringInviteeActivatesInvitationAndKeepsAllocation() throws Exception {
        UUID loanId = createLoan("10000");
        inviteLender(loanId, "carol@example.com", "3000").andExpect(status().isCreated());

        MvcResult registration = mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "Carol@Example.com",
                                  "name": "Carol",
                                  "password": "Secret123"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.isLender").value(true))
                .andExpect(jsonPath("$.user.isBorrower").value(true))
                .andReturn();
        JsonNode registered = json(registration);
        UUID carolId = UUID.fromString(registered.path("user").path("userId").asText());
        String carolToken = "Bearer " + registered.path("tokens").path("accessToken").asText();

        List<EmailInvitation> invitations =
                emailInvitationRepository.findByEmailAndStatus("carol@example.com", EmailInvitationStatus.ACTIVATED);
        assertThat(invitations).hasSize(1);

        List<LoanParticipant> participants = loanParticipantRepository.findByLenderWithLoan(carolId);
        assertThat(participants).singleElement()
                .satisfies(participant -> assertThat(participant.getAllocation()).isEqualByComparingTo("3000"));

        mockMvc.perform(get("/lender/pending").header("Authorization", carolToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].allocation").value(3000.0));
    }

    @Test
    void duplicateRegistrationIsConflict() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "BORROWER@example.com", "name": "Again", "password": "Secret123"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("EMAIL_ALREADY_REGISTERED"));
    }

    @Test
    void requestsWithoutValidTokenAreUnauthorized() throws Exception {
        mockMvc.perform(get("/loans/my-loans"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        mockMvc.perform(get("/loans/my-loans").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    void strangerCannotReadLoan() throws Exception {
        UUID loanId = createLoan("5000");
        UserAccount stranger = testUserFactory.ensureUser("stranger@example.com", "Sam", Capability.BORROWER);

        mockMvc.perform(get("/loans/{loanId}", loanId).header("Authorization", testUserFactory.bearer(stranger)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("ACCESS_DENIED"));
    }

    @Test
    void invalidLoanPayloadReportsFieldErrors() throws Exception {
        mockMvc.perform(post("/loans")
                        .header("Authorization", borrowerToken)
                        .header("X-Request-Id", "req-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"loanName": "", "principal": 1000}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(header().string("X-Request-Id", "req-123"))
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.requestId").value("req-123"))
                .andExpect(jsonPath("$.details.loanName").exists());
    }

    @Test
    void dashboardReflectsBorrowerLoans() throws Exception {
        createLoan("5000");

        mockMvc.perform(get("/user/dashboard").header("Authorization", borrowerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.borrower.pendingRequests").value(1))
                .andExpect(jsonPath("$.borrower.activeLoans").value(0));
    }

    private UUID createLoan(String principal) throws Exception {
        MvcResult result = mockMvc.perform(post("/loans")
                        .header("Authorization", borrowerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "loanName": "Kitchen remodel",
                                  "principal": %s,
                                  "interestRate": 5,
                                  "purpose": "home",
                                  "description": "Replacing cabinets and counters",
                                  "paymentFrequency": "MONTHLY",
                                  "termLengthMonths": 12,
                                  "startDate": "%s"
                                }
                                """.formatted(principal, LocalDate.now(ZoneOffset.UTC).plusDays(7))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.loan.status").value("PENDING"))
                .andReturn();
        return UUID.fromString(json(result).path("loan").path("loanId").asText());
    }

    private JsonResultActions inviteLender(UUID loanId, String email, String amount) throws Exception {
        return new JsonResultActions(mockMvc.perform(post("/loans/{loanId}/invitations", loanId)
                .header("Authorization", borrowerToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"lenders": [{"email": "%s", "amount": %s}]}
                        """.formatted(email, amount))));
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private final class JsonResultActions {

        private final ResultActions actions;

        private JsonResultActions(ResultActions actions) {
            this.actions = actions;
        }

        JsonResultActions andExpect(ResultMatcher matcher) throws Exception {
            actions.andExpect(matcher);
            return this;
        }

        JsonNode andReturnJson() throws Exception {
            return json(actions.andReturn());
        }
    }
}
