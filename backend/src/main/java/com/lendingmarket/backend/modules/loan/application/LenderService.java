package com.lendingmarket.backend.modules.loan.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

import com.lendingmarket.backend.global.error.ErrorCode;
import com.lendingmarket.backend.global.error.ProblemException;
import com.lendingmarket.backend.modules.audit.application.AuditLogService;
import com.lendingmarket.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.lendingmarket.backend.modules.auth.application.UserCapabilityService;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.loan.domain.AchAccountType;
import com.lendingmarket.backend.modules.loan.domain.AchDetail;
import com.lendingmarket.backend.modules.loan.domain.Loan;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.domain.LoanStatus;
import com.lendingmarket.backend.modules.loan.domain.ParticipantStatus;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.AchDetailRepository;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanParticipantRepository;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.lendingmarket.backend.modules.loan.presentation.dto.AcceptInvitationRequest;
import com.lendingmarket.backend.modules.loan.presentation.dto.InvitationDecisionResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.LenderSearchResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.LoanDtoMapper;
import com.lendingmarket.backend.modules.loan.presentation.dto.PendingInvitationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Lender side of an invitation: listing, accepting with ACH details, declining.
 *
 * <p>Every mutation locks the loan row before the participant row and re-checks its preconditions
 * against the locked state, so concurrent acceptances on one loan are serialized.
 */
@Service
@Transactional
public class LenderService {

    private static final Logger log = LoggerFactory.getLogger(LenderService.class);

    private static final Pattern ROUTING_NUMBER = Pattern.compile("^\\d{9}$");
    private static final Pattern ACCOUNT_NUMBER = Pattern.compile("^\\d{4,17}$");
    private static final int MAX_BANK_NAME_LENGTH = 100;
    private static final int MAX_SPECIAL_INSTRUCTIONS_LENGTH = 500;
    private static final int SEARCH_LIMIT = 20;

    private final LoanRepository loanRepository;
    private final LoanParticipantRepository loanParticipantRepository;
    private final AchDetailRepository achDetailRepository;
    private final UserCapabilityService userCapabilityService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public LenderService(
            LoanRepository loanRepository,
            LoanParticipantRepository loanParticipantRepository,
            AchDetailRepository achDetailRepository,
            UserCapabilityService userCapabilityService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.loanRepository = loanRepository;
        this.loanParticipantRepository = loanParticipantRepository;
        this.achDetailRepository = achDetailRepository;
        this.userCapabilityService = userCapabilityService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<PendingInvitationResponse> listPendingInvitations(UUID lenderId) {
        userCapabilityService.requireActiveUser(lenderId);
        return loanParticipantRepository.findByLenderAndStatus(lenderId, ParticipantStatus.PENDING).stream()
                .map(LoanDtoMapper::toPendingInvitation)
                .toList();
    }

    public InvitationDecisionResponse acceptInvitation(UUID lenderId, UUID loanId, AcceptInvitationRequest request) {
        AchAccountType accountType = validateAch(request);
        UserAccount lender = userCapabilityService.requireActiveUser(lenderId);

        Loan loan = loanRepository.findByIdForUpdate(loanId)
                .orElseThrow(() -> new ProblemException(ErrorCode.LOAN_NOT_FOUND, "Loan not found"));
        LoanParticipant participant = loanParticipantRepository.findOwnForUpdate(loanId, lenderId, lender.getEmail())
                .orElseThrow(() -> new ProblemException(ErrorCode.ACCESS_DENIED, "No invitation to this loan"));

        if (participant.getStatus() != ParticipantStatus.PENDING) {
            throw new ProblemException(ErrorCode.ALREADY_ACCEPTED,
                    "Invitation was already " + participant.getStatus().name().toLowerCase(Locale.ROOT));
        }
        if (loan.getStatus() == LoanStatus.CANCELLED || loan.getStatus() == LoanStatus.DRAFT) {
            throw new ProblemException(ErrorCode.LOAN_NOT_OPEN, "Loan is not open for funding");
        }
        if (loan.getStatus() != LoanStatus.PENDING || loan.isFullyFunded()) {
            throw new ProblemException(ErrorCode.LOAN_FULLY_FUNDED, "Loan is already fully funded");
        }
        BigDecimal newTotalFunded = loan.getTotalFunded().add(participant.getAllocation());
        if (newTotalFunded.compareTo(loan.getPrincipal()) > 0) {
            log.warn("Rejected acceptance of participant {} on loan {}: funding {} + {} exceeds principal {}",
                    participant.getId(), loanId, loan.getTotalFunded(), participant.getAllocation(), loan.getPrincipal());
            throw new ProblemException(ErrorCode.INVALID_AMOUNT, "Accepting would exceed the loan principal");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (participant.getLender() == null) {
            participant.setLender(lender);
        }
        participant.setStatus(ParticipantStatus.ACCEPTED);
        participant.setRespondedAt(now);
        participant.setRemainingBalance(participant.getAllocation());
        loanParticipantRepository.saveAndFlush(participant);

        AchDetail achDetail = new AchDetail();
        achDetail.setParticipant(participant);
        achDetail.setLoan(loan);
        achDetail.setLender(lender);
        achDetail.setBankName(request.bankName().trim());
        achDetail.setAccountType(accountType);
        achDetail.setRoutingNumber(request.routingNumber().trim());
        achDetail.setAccountNumber(request.accountNumber().trim());
        achDetail.setSpecialInstructions(StringUtils.hasText(request.specialInstructions())
                ? request.specialInstructions().trim()
                : null);
        achDetailRepository.save(achDetail);

        loan.setTotalFunded(newTotalFunded);
        if (loan.isFullyFunded()) {
            loan.setStatus(LoanStatus.ACTIVE);
            loan.setActivatedAt(now);
        }
        loanRepository.save(loan);
        userCapabilityService.grant(lender, Capability.LENDER);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("loanId", loanId.toString());
        detail.put("allocation", participant.getAllocation());
        detail.put("totalFunded", newTotalFunded);
        detail.put("loanStatus", loan.getStatus().name());
        auditLogService.record(new AuditLogCommand(
                "INVITATION_ACCEPTED",
                "LOAN_PARTICIPANT",
                participant.getId().toString(),
                lenderId,
                detail
        ));
        log.info("Lender {} accepted {} on loan {} (funded {}/{})",
                lenderId, participant.getAllocation(), loanId, newTotalFunded, loan.getPrincipal());
        if (loan.getStatus() == LoanStatus.ACTIVE) {
            log.info("Loan {} is fully funded and now ACTIVE", loanId);
        }
        return LoanDtoMapper.toDecision(participant);
    }

    /**
     * Declining is terminal and leaves the loan's invited and funded totals untouched.
     */
    public InvitationDecisionResponse declineInvitation(UUID lenderId, UUID loanId) {
        UserAccount lender = userCapabilityService.requireActiveUser(lenderId);

        Loan loan = loanRepository.findByIdForUpdate(loanId)
                .orElseThrow(() -> new ProblemException(ErrorCode.LOAN_NOT_FOUND, "Loan not found"));
        LoanParticipant participant = loanParticipantRepository.findOwnForUpdate(loanId, lenderId, lender.getEmail())
                .orElseThrow(() -> new ProblemException(ErrorCode.ACCESS_DENIED, "No invitation to this loan"));

        if (participant.getStatus() != ParticipantStatus.PENDING) {
            throw new ProblemException(ErrorCode.ALREADY_ACCEPTED,
                    "Invitation was already " + participant.getStatus().name().toLowerCase(Locale.ROOT));
        }

        if (participant.getLender() == null) {
            participant.setLender(lender);
        }
        participant.setStatus(ParticipantStatus.DECLINED);
        participant.setRespondedAt(OffsetDateTime.now(clock));
        loanParticipantRepository.save(participant);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("loanId", loanId.toString());
        detail.put("allocation", participant.getAllocation());
        auditLogService.record(new AuditLogCommand(
                "INVITATION_DECLINED",
                "LOAN_PARTICIPANT",
                participant.getId().toString(),
                lenderId,
                detail
        ));
        log.info("Lender {} declined invitation on loan {}", lenderId, loanId);
        return LoanDtoMapper.toDecision(participant);
    }

    /**
     * Lenders who were previously invited to any of the borrower's loans, matched on name or email.
     */
    @Transactional(readOnly = true)
    public List<LenderSearchResponse> searchLenders(UUID borrowerId, String query) {
        userCapabilityService.requireCapability(borrowerId, Capability.BORROWER);
        String needle = StringUtils.hasText(query) ? query.trim().toLowerCase(Locale.ROOT) : null;

        Map<UUID, LenderAggregate> aggregates = new LinkedHashMap<>();
        for (LoanParticipant participant : loanParticipantRepository.findLinkedByBorrower(borrowerId)) {
            UserAccount lender = participant.getLender();
            if (needle != null
                    && !lender.getDisplayName().toLowerCase(Locale.ROOT).contains(needle)
                    && !lender.getEmail().toLowerCase(Locale.ROOT).contains(needle)) {
                continue;
            }
            aggregates.computeIfAbsent(lender.getId(), id -> new LenderAggregate(lender)).add(participant);
        }

        return aggregates.values().stream()
                .map(LenderAggregate::toResponse)
                .sorted(Comparator.comparing(LenderSearchResponse::name, String.CASE_INSENSITIVE_ORDER))
                .limit(SEARCH_LIMIT)
                .toList();
    }

    private AchAccountType validateAch(AcceptInvitationRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request == null) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "ACH details are required");
        }
        if (!StringUtils.hasText(request.bankName())) {
            errors.put("bankName", "bank name is required");
        } else if (request.bankName().trim().length() > MAX_BANK_NAME_LENGTH) {
            errors.put("bankName", "bank name must be at most " + MAX_BANK_NAME_LENGTH + " characters");
        }
        if (request.routingNumber() == null || !ROUTING_NUMBER.matcher(request.routingNumber().trim()).matches()) {
            errors.put("routingNumber", "routing number must be exactly 9 digits");
        }
        if (request.accountNumber() == null || !ACCOUNT_NUMBER.matcher(request.accountNumber().trim()).matches()) {
            errors.put("accountNumber", "account number must be 4-17 digits");
        }
        AchAccountType accountType = null;
        try {
            accountType = AchAccountType.from(request.accountType());
        } catch (IllegalArgumentException ex) {
            errors.put("accountType", "account type must be checking or savings");
        }
        if (request.specialInstructions() != null
                && request.specialInstructions().length() > MAX_SPECIAL_INSTRUCTIONS_LENGTH) {
            errors.put("specialInstructions",
                    "special instructions must be at most " + MAX_SPECIAL_INSTRUCTIONS_LENGTH + " characters");
        }
        if (!errors.isEmpty()) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "Invalid ACH details", errors);
        }
        return accountType;
    }

    private static final class LenderAggregate {

        private final UserAccount lender;
        private int investmentCount;
        private BigDecimal totalLent = BigDecimal.ZERO;
        private OffsetDateTime lastInvitedAt;

        private LenderAggregate(UserAccount lender) {
            this.lender = lender;
        }

        private void add(LoanParticipant participant) {
            if (participant.getStatus() == ParticipantStatus.ACCEPTED) {
                investmentCount++;
                totalLent = totalLent.add(participant.getAllocation());
            }
            if (lastInvitedAt == null || participant.getInvitedAt().isAfter(lastInvitedAt)) {
                lastInvitedAt = participant.getInvitedAt();
            }
        }

        private LenderSearchResponse toResponse() {
            return new LenderSearchResponse(
                    lender.getId(),
                    lender.getDisplayName(),
                    lender.getEmail(),
                    investmentCount,
                    totalLent,
                    lastInvitedAt
            );
        }
    }
}
