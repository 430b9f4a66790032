package com.lendingmarket.backend.modules.repayment.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Borrower-reported repayments and their review by the receiving lender.
 *
 * <p>Lock order is loan, then repayment, then participant, matching the acceptance path.
 */
@Service
@Transactional
public class RepaymentService {

    private static final Logger log = LoggerFactory.getLogger(RepaymentService.class);

    private final RepaymentRepository repaymentRepository;
    private final LoanRepository loanRepository;
    private final LoanParticipantRepository loanParticipantRepository;
    private final UserCapabilityService userCapabilityService;
    private final AuditLogService auditLogService;
    private final LendingProperties lendingProperties;
    private final Clock clock;

    public RepaymentService(
            RepaymentRepository repaymentRepository,
            LoanRepository loanRepository,
            LoanParticipantRepository loanParticipantRepository,
            UserCapabilityService userCapabilityService,
            AuditLogService auditLogService,
            LendingProperties lendingProperties,
            Clock clock
    ) {
        this.repaymentRepository = repaymentRepository;
        this.loanRepository = loanRepository;
        this.loanParticipantRepository = loanParticipantRepository;
        this.userCapabilityService = userCapabilityService;
        this.auditLogService = auditLogService;
        this.lendingProperties = lendingProperties;
        this.clock = clock;
    }

    public RepaymentResponse submitPayment(UUID borrowerId, SubmitRepaymentRequest request) {
        UserAccount borrower = userCapabilityService.requireCapability(borrowerId, Capability.BORROWER);

        BigDecimal amount = request.amount();
        if (amount == null || amount.signum() <= 0 || amount.scale() > 2) {
            throw new ProblemException(ErrorCode.INVALID_AMOUNT,
                    "Repayment amount must be positive with at most 2 decimal places");
        }
        if (request.paymentDate() == null || request.paymentDate().isAfter(LocalDate.now(clock))) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "Payment date cannot be in the future");
        }

        Loan loan = loanRepository.findByIdForUpdate(request.loanId())
                .orElseThrow(() -> new ProblemException(ErrorCode.LOAN_NOT_FOUND, "Loan not found"));
        if (!loan.isBorrower(borrowerId)) {
            throw new ProblemException(ErrorCode.ACCESS_DENIED, "Only the borrower may submit repayments");
        }
        if (loan.getStatus() != LoanStatus.ACTIVE) {
            throw new ProblemException(ErrorCode.LOAN_NOT_ACTIVE, "Repayments are accepted only on active loans");
        }

        LoanParticipant participant = loanParticipantRepository.findById(request.participantId())
                .filter(candidate -> candidate.getLoan().getId().equals(loan.getId()))
                .orElseThrow(() -> new ProblemException(ErrorCode.PARTICIPANT_NOT_FOUND,
                        "Participant not found on this loan"));
        if (participant.getStatus() != ParticipantStatus.ACCEPTED) {
            throw new ProblemException(ErrorCode.PARTICIPANT_NOT_ACCEPTED, "Participant has not funded this loan");
        }

        if (!lendingProperties.repayment().allowOverpayment()) {
            BigDecimal pending = nullToZero(repaymentRepository.sumAmountByParticipantAndStatus(
                    participant.getId(), RepaymentStatus.PENDING));
            BigDecimal outstanding = participant.getRemainingBalance().subtract(pending);
            if (amount.compareTo(outstanding) > 0) {
                log.debug("Rejected repayment of {} on participant {}: outstanding {}", amount, participant.getId(),
                        outstanding);
                throw new ProblemException(ErrorCode.INVALID_AMOUNT,
                        "Amount exceeds the outstanding balance of " + outstanding.max(BigDecimal.ZERO));
            }
        }

        Repayment repayment = new Repayment();
        repayment.setLoan(loan);
        repayment.setParticipant(participant);
        repayment.setBorrower(borrower);
        repayment.setAmount(amount);
        repayment.setPaymentDate(request.paymentDate());
        repayment.setNotes(trimToNull(request.notes()));
        repayment.setProofReference(trimToNull(request.proofReference()));
        repayment.setStatus(RepaymentStatus.PENDING);
        repayment = repaymentRepository.save(repayment);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("loanId", loan.getId().toString());
        detail.put("participantId", participant.getId().toString());
        detail.put("amount", amount);
        auditLogService.record(new AuditLogCommand(
                "REPAYMENT_SUBMITTED",
                "REPAYMENT",
                repayment.getId().toString(),
                borrowerId,
                detail
        ));
        log.info("Borrower {} submitted repayment {} of {} on loan {}", borrowerId, repayment.getId(), amount,
                loan.getId());
        return RepaymentResponse.from(repayment);
    }

    public RepaymentResponse reviewPayment(UUID repaymentId, UUID reviewerId, ReviewRepaymentRequest request) {
        UserAccount reviewer = userCapabilityService.requireActiveUser(reviewerId);
        ReviewDecision decision = request.decision();
        if (decision == null) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "decision is required");
        }

        UUID loanId = repaymentRepository.findLoanIdByRepaymentId(repaymentId)
                .orElseThrow(() -> new ProblemException(ErrorCode.REPAYMENT_NOT_FOUND, "Repayment not found"));
        Loan loan = loanRepository.findByIdForUpdate(loanId)
                .orElseThrow(() -> new ProblemException(ErrorCode.LOAN_NOT_FOUND, "Loan not found"));
        Repayment repayment = repaymentRepository.findByIdForUpdate(repaymentId)
                .orElseThrow(() -> new ProblemException(ErrorCode.REPAYMENT_NOT_FOUND, "Repayment not found"));
        LoanParticipant participant = loanParticipantRepository.findByIdForUpdate(repayment.getParticipant().getId())
                .orElseThrow(() -> new ProblemException(ErrorCode.PARTICIPANT_NOT_FOUND, "Participant not found"));

        boolean ownsParticipant = participant.getLender() != null && participant.getLender().getId().equals(reviewerId);
        if (!ownsParticipant && !userCapabilityService.hasCapability(reviewerId, Capability.ADMIN)) {
            throw new ProblemException(ErrorCode.ACCESS_DENIED, "Only the receiving lender may review this repayment");
        }
        if (repayment.getStatus() != RepaymentStatus.PENDING) {
            throw new ProblemException(ErrorCode.ALREADY_REVIEWED,
                    "Repayment was already " + repayment.getStatus().name().toLowerCase(Locale.ROOT));
        }

        String notes = trimToNull(request.notes());
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (decision == ReviewDecision.APPROVED) {
            applyApproval(loan, participant, repayment);
        } else {
            int minLength = lendingProperties.repayment().minRejectionReasonLength();
            if (notes == null || notes.length() < minLength) {
                throw new ProblemException(ErrorCode.VALIDATION_ERROR,
                        "Rejection reason must be at least " + minLength + " characters");
            }
        }

        repayment.setStatus(decision.toStatus());
        repayment.setReviewedBy(reviewer);
        repayment.setReviewedAt(now);
        repayment.setReviewNotes(notes);
        repaymentRepository.save(repayment);

        if (decision == ReviewDecision.APPROVED) {
            loanParticipantRepository.saveAndFlush(participant);
            if (loanParticipantRepository.countOutstanding(loan.getId()) == 0) {
                loan.setStatus(LoanStatus.COMPLETED);
                loan.setCompletedAt(now);
                log.info("Loan {} fully repaid and now COMPLETED", loan.getId());
            }
            loanRepository.save(loan);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("decision", decision.name());
        detail.put("amount", repayment.getAmount());
        detail.put("remainingBalance", participant.getRemainingBalance());
        detail.put("loanStatus", loan.getStatus().name());
        auditLogService.record(new AuditLogCommand(
                "REPAYMENT_" + decision.name(),
                "REPAYMENT",
                repaymentId.toString(),
                reviewerId,
                detail
        ));
        log.info("Repayment {} {} by {}", repaymentId, decision, reviewerId);
        return RepaymentResponse.from(repayment);
    }

    @Transactional(readOnly = true)
    public List<RepaymentResponse> listPendingRepayments(UUID reviewerId) {
        userCapabilityService.requireActiveUser(reviewerId);
        List<Repayment> repayments = userCapabilityService.hasCapability(reviewerId, Capability.ADMIN)
                ? repaymentRepository.findAllPending()
                : repaymentRepository.findPendingForLender(reviewerId);
        return repayments.stream().map(RepaymentResponse::from).toList();
    }

    /**
     * The borrower and admins see every repayment on the loan; a lender sees only their own.
     */
    @Transactional(readOnly = true)
    public List<RepaymentResponse> listLoanRepayments(UUID loanId, UUID requesterId) {
        UserAccount requester = userCapabilityService.requireActiveUser(requesterId);
        Loan loan = loanRepository.findByIdWithBorrower(loanId)
                .orElseThrow(() -> new ProblemException(ErrorCode.LOAN_NOT_FOUND, "Loan not found"));
        List<Repayment> repayments = repaymentRepository.findByLoanIdWithContext(loanId);

        if (loan.isBorrower(requesterId) || userCapabilityService.hasCapability(requesterId, Capability.ADMIN)) {
            return repayments.stream().map(RepaymentResponse::from).toList();
        }
        boolean participates = loanParticipantRepository.findOwn(loanId, requesterId, requester.getEmail()).isPresent();
        if (!participates) {
            throw new ProblemException(ErrorCode.ACCESS_DENIED, "Not a participant of this loan");
        }
        return repayments.stream()
                .filter(repayment -> repayment.getParticipant().isOwnedBy(requesterId, requester.getEmail()))
                .map(RepaymentResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public RepaymentResponse getRepayment(UUID repaymentId, UUID requesterId) {
        userCapabilityService.requireActiveUser(requesterId);
        Repayment repayment = repaymentRepository.findByIdWithContext(repaymentId)
                .orElseThrow(() -> new ProblemException(ErrorCode.REPAYMENT_NOT_FOUND, "Repayment not found"));
        boolean borrower = repayment.getLoan().isBorrower(requesterId);
        boolean lender = repayment.getParticipant().getLender() != null
                && repayment.getParticipant().getLender().getId().equals(requesterId);
        if (!borrower && !lender && !userCapabilityService.hasCapability(requesterId, Capability.ADMIN)) {
            throw new ProblemException(ErrorCode.ACCESS_DENIED, "Not allowed to view this repayment");
        }
        return RepaymentResponse.from(repayment);
    }

    private void applyApproval(Loan loan, LoanParticipant participant, Repayment repayment) {
        BigDecimal amount = repayment.getAmount();
        if (!lendingProperties.repayment().allowOverpayment()
                && amount.compareTo(participant.getRemainingBalance()) > 0) {
            throw new ProblemException(ErrorCode.INVALID_AMOUNT,
                    "Amount exceeds the remaining balance of " + participant.getRemainingBalance());
        }
        participant.setRemainingBalance(participant.getRemainingBalance().subtract(amount));
        participant.setTotalRepaid(participant.getTotalRepaid().add(amount));
        loan.setTotalRepaid(loan.getTotalRepaid().add(amount));
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
