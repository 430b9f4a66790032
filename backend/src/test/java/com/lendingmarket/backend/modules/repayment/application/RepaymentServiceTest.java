package com.lendingmarket.backend.modules.repayment.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.lendingmarket.backend.global.config.LendingProperties;
import com.lendingmarket.backend.global.error.ErrorCode;
import com.lendingmarket.backend.global.error.ProblemException;
import com.lendingmarket.backend.modules.audit.application.AuditLogService;
import com.lendingmarket.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.lendingmarket.backend.modules.auth.application.UserCapabilityService;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.loan.domain.Loan;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.domain.LoanStatus;
import com.lendingmarket.backend.modules.loan.domain.ParticipantStatus;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanParticipantRepository;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.lendingmarket.backend.modules.repayment.domain.Repayment;
import com.lendingmarket.backend.modules.repayment.domain.RepaymentStatus;
import com.lendingmarket.backend.modules.repayment.domain.ReviewDecision;
import com.lendingmarket.backend.modules.repayment.infrastructure.persistence.RepaymentRepository;
import com.lendingmarket.backend.modules.repayment.presentation.dto.RepaymentResponse;
import com.lendingmarket.backend.modules.repayment.presentation.dto.ReviewRepaymentRequest;
import com.lendingmarket.backend.modules.repayment.presentation.dto.SubmitRepaymentRequest;
import com.lendingmarket.backend.support.LedgerFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RepaymentServiceTest {

    private static final LocalDate TODAY = LedgerFixtures.NOW.toLocalDate();

    @Mock
    private RepaymentRepository repaymentRepository;

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private LoanParticipantRepository loanParticipantRepository;

    @Mock
    private UserCapabilityService userCapabilityService;

    @Mock
    private AuditLogService auditLogService;

    private RepaymentService repaymentService;

    private UserAccount borrower;
    private UserAccount lender;
    private Loan loan;
    private LoanParticipant participant;

    @BeforeEach
    void setUp() {
        repaymentService = newService(LendingProperties.defaults());
        borrower = LedgerFixtures.user("borrower@example.com", "Bea Borrower");
        lender = LedgerFixtures.user("lender@example.com", "Len Lender");
        loan = LedgerFixtures.pendingLoan(borrower, "10000");
        loan.setStatus(LoanStatus.ACTIVE);
        loan.setTotalInvited(new BigDecimal("10000"));
        loan.setTotalFunded(new BigDecimal("10000"));
        participant = LedgerFixtures.participant(loan, lender, lender.getEmail(), "10000", ParticipantStatus.ACCEPTED);
    }

    @Test
    void submitRecordsPendingRepayment() {
        stubSubmitContext();
        when(repaymentRepository.sumAmountByParticipantAndStatus(participant.getId(), RepaymentStatus.PENDING))
                .thenReturn(null);
        when(repaymentRepository.save(any(Repayment.class)))
                .thenAnswer(invocation -> LedgerFixtures.withGeneratedId(invocation.getArgument(0)));

        RepaymentResponse response = repaymentService.submitPayment(borrower.getId(),
                new SubmitRepaymentRequest(loan.getId(), participant.getId(), new BigDecimal("500.00"), TODAY,
                        "  January  ", null));

        assertThat(response.status()).isEqualTo("PENDING");
        assertThat(response.amount()).isEqualByComparingTo("500");
        assertThat(response.notes()).isEqualTo("January");
        assertThat(participant.getRemainingBalance()).isEqualByComparingTo("10000");

        ArgumentCaptor<AuditLogCommand> auditCaptor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(auditCaptor.capture());
        assertThat(auditCaptor.getValue().actionType()).isEqualTo("REPAYMENT_SUBMITTED");
    }

    @Test
    @DisplayName("pending repayments count against the outstanding balance")
    void submitRejectsOverpaymentIncludingPending() {
        stubSubmitContext();
        when(repaymentRepository.sumAmountByParticipantAndStatus(participant.getId(), RepaymentStatus.PENDING))
                .thenReturn(new BigDecimal("9800"));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> repaymentService.submitPayment(borrower.getId(),
                        new SubmitRepaymentRequest(loan.getId(), participant.getId(), new BigDecimal("300"), TODAY,
                                null, null)));

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_AMOUNT);
        verify(repaymentRepository, never()).save(any());
    }

    @Test
    void overpaymentAllowedWhenConfigured() {
        repaymentService = newService(new LendingProperties(
                LendingProperties.defaults().loan(), new LendingProperties.Repayment(true, 10)));
        stubSubmitContext();
        when(repaymentRepository.save(any(Repayment.class)))
                .thenAnswer(invocation -> LedgerFixtures.withGeneratedId(invocation.getArgument(0)));

        RepaymentResponse response = repaymentService.submitPayment(borrower.getId(),
                new SubmitRepaymentRequest(loan.getId(), participant.getId(), new BigDecimal("12000"), TODAY,
                        null, null));

        assertThat(response.amount()).isEqualByComparingTo("12000");
    }

    @Test
    void submitRejectsFuturePaymentDate() {
        when(userCapabilityService.requireCapability(borrower.getId(), Capability.BORROWER)).thenReturn(borrower);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> repaymentService.submitPayment(borrower.getId(),
                        new SubmitRepaymentRequest(loan.getId(), participant.getId(), new BigDecimal("10"),
                                TODAY.plusDays(1), null, null)));

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void submitRequiresActiveLoan() {
        loan.setStatus(LoanStatus.PENDING);
        when(userCapabilityService.requireCapability(borrower.getId(), Capability.BORROWER)).thenReturn(borrower);
        when(loanRepository.findByIdForUpdate(loan.getId())).thenReturn(Optional.of(loan));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> repaymentService.submitPayment(borrower.getId(),
                        new SubmitRepaymentRequest(loan.getId(), participant.getId(), new BigDecimal("10"), TODAY,
                                null, null)));

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.LOAN_NOT_ACTIVE);
    }

    @Test
    void submitRequiresAcceptedParticipant() {
        participant.setStatus(ParticipantStatus.DECLINED);
        stubSubmitContext();

        ProblemException ex = assertThrows(ProblemException.class,
                () -> repaymentService.submitPayment(borrower.getId(),
                        new SubmitRepaymentRequest(loan.getId(), participant.getId(), new BigDecimal("10"), TODAY,
                                null, null)));

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.PARTICIPANT_NOT_ACCEPTED);
    }

    @Test
    void approvalReducesBalanceAndKeepsLoanActiveWhileOutstanding() {
        Repayment repayment = pendingRepayment("500");
        stubReviewContext(repayment, lender);
        when(loanParticipantRepository.countOutstanding(loan.getId())).thenReturn(1L);

        RepaymentResponse response = repaymentService.reviewPayment(repayment.getId(), lender.getId(),
                new ReviewRepaymentRequest(ReviewDecision.APPROVED, null));

        assertThat(response.status()).isEqualTo("APPROVED");
        assertThat(response.reviewedBy()).isEqualTo(lender.getId());
        assertThat(participant.getRemainingBalance()).isEqualByComparingTo("9500");
        assertThat(participant.getTotalRepaid()).isEqualByComparingTo("500");
        assertThat(loan.getTotalRepaid()).isEqualByComparingTo("500");
        assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
    }

    @Test
    void finalApprovalCompletesLoan() {
        participant.setRemainingBalance(new BigDecimal("250"));
        Repayment repayment = pendingRepayment("250");
        stubReviewContext(repayment, lender);
        when(loanParticipantRepository.countOutstanding(loan.getId())).thenReturn(0L);

        repaymentService.reviewPayment(repayment.getId(), lender.getId(),
                new ReviewRepaymentRequest(ReviewDecision.APPROVED, "thanks"));

        assertThat(participant.getRemainingBalance()).isEqualByComparingTo("0");
        assertThat(loan.getStatus()).isEqualTo(LoanStatus.COMPLETED);
        assertThat(loan.getCompletedAt()).isEqualTo(LedgerFixtures.NOW);
    }

    @Test
    void rejectionNeedsAReason() {
        Repayment repayment = pendingRepayment("500");
        stubReviewContext(repayment, lender);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> repaymentService.reviewPayment(repayment.getId(), lender.getId(),
                        new ReviewRepaymentRequest(ReviewDecision.REJECTED, "no")));

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(repayment.getStatus()).isEqualTo(RepaymentStatus.PENDING);
    }

    @Test
    void rejectionLeavesBalancesUntouched() {
        Repayment repayment = pendingRepayment("500");
        stubReviewContext(repayment, lender);

        RepaymentResponse response = repaymentService.reviewPayment(repayment.getId(), lender.getId(),
                new ReviewRepaymentRequest(ReviewDecision.REJECTED, "Transfer never arrived"));

        assertThat(response.status()).isEqualTo("REJECTED");
        assertThat(response.reviewNotes()).isEqualTo("Transfer never arrived");
        assertThat(participant.getRemainingBalance()).isEqualByComparingTo("10000");
        assertThat(loan.getTotalRepaid()).isEqualByComparingTo("0");
        verify(loanParticipantRepository, never()).countOutstanding(any());
    }

    @Test
    void reviewedRepaymentCannotBeReviewedAgain() {
        Repayment repayment = pendingRepayment("500");
        repayment.setStatus(RepaymentStatus.APPROVED);
        stubReviewContext(repayment, lender);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> repaymentService.reviewPayment(repayment.getId(), lender.getId(),
                        new ReviewRepaymentRequest(ReviewDecision.APPROVED, null)));

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.ALREADY_REVIEWED);
        assertThat(ex.getDetailMessage()).isEqualTo("Repayment was already approved");
    }

    @Test
    void onlyReceivingLenderMayReview() {
        Repayment repayment = pendingRepayment("500");
        stubReviewContext(repayment, borrower);
        when(userCapabilityService.hasCapability(borrower.getId(), Capability.ADMIN)).thenReturn(false);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> repaymentService.reviewPayment(repayment.getId(), borrower.getId(),
                        new ReviewRepaymentRequest(ReviewDecision.APPROVED, null)));

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.ACCESS_DENIED);
        assertThat(participant.getRemainingBalance()).isEqualByComparingTo("10000");
    }

    @Test
    void lenderSeesOnlyOwnRepaymentsOnLoan() {
        UserAccount other = LedgerFixtures.user("other@example.com", "Olga");
        LoanParticipant otherParticipant = LedgerFixtures.participant(
                loan, other, other.getEmail(), "5000", ParticipantStatus.ACCEPTED);
        Repayment mine = pendingRepayment("100");
        Repayment theirs = pendingRepayment("200");
        theirs.setParticipant(otherParticipant);
        when(userCapabilityService.requireActiveUser(lender.getId())).thenReturn(lender);
        when(loanRepository.findByIdWithBorrower(loan.getId())).thenReturn(Optional.of(loan));
        when(repaymentRepository.findByLoanIdWithContext(loan.getId())).thenReturn(List.of(mine, theirs));
        lenient().when(userCapabilityService.hasCapability(lender.getId(), Capability.ADMIN)).thenReturn(false);
        when(loanParticipantRepository.findOwn(loan.getId(), lender.getId(), lender.getEmail()))
                .thenReturn(Optional.of(participant));

        List<RepaymentResponse> visible = repaymentService.listLoanRepayments(loan.getId(), lender.getId());

        assertThat(visible).extracting(RepaymentResponse::repaymentId).containsExactly(mine.getId());
    }

    private RepaymentService newService(LendingProperties properties) {
        Clock clock = Clock.fixed(LedgerFixtures.NOW.toInstant(), ZoneOffset.UTC);
        return new RepaymentService(
                repaymentRepository,
                loanRepository,
                loanParticipantRepository,
                userCapabilityService,
                auditLogService,
                properties,
                clock
        );
    }

    private Repayment pendingRepayment(String amount) {
        Repayment repayment = new Repayment();
        repayment.setLoan(loan);
        repayment.setParticipant(participant);
        repayment.setBorrower(borrower);
        repayment.setAmount(new BigDecimal(amount));
        repayment.setPaymentDate(TODAY);
        repayment.setStatus(RepaymentStatus.PENDING);
        return LedgerFixtures.withGeneratedId(repayment);
    }

    private void stubSubmitContext() {
        when(userCapabilityService.requireCapability(borrower.getId(), Capability.BORROWER)).thenReturn(borrower);
        when(loanRepository.findByIdForUpdate(loan.getId())).thenReturn(Optional.of(loan));
        when(loanParticipantRepository.findById(participant.getId())).thenReturn(Optional.of(participant));
    }

    private void stubReviewContext(Repayment repayment, UserAccount reviewer) {
        when(userCapabilityService.requireActiveUser(reviewer.getId())).thenReturn(reviewer);
        when(repaymentRepository.findLoanIdByRepaymentId(repayment.getId())).thenReturn(Optional.of(loan.getId()));
        when(loanRepository.findByIdForUpdate(loan.getId())).thenReturn(Optional.of(loan));
        when(repaymentRepository.findByIdForUpdate(repayment.getId())).thenReturn(Optional.of(repayment));
        when(loanParticipantRepository.findByIdForUpdate(participant.getId())).thenReturn(Optional.of(participant));
    }
}
