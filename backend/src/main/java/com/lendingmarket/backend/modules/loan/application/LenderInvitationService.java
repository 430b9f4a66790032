package com.lendingmarket.backend.modules.loan.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.lendingmarket.backend.global.error.ErrorCode;
import com.lendingmarket.backend.global.error.ProblemException;
import com.lendingmarket.backend.modules.audit.application.AuditLogService;
import com.lendingmarket.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.lendingmarket.backend.modules.auth.application.AuthService;
import com.lendingmarket.backend.modules.auth.application.UserCapabilityService;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.lendingmarket.backend.modules.invitation.infrastructure.persistence.EmailInvitationRepository;
import com.lendingmarket.backend.modules.loan.domain.Loan;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.domain.ParticipantStatus;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanParticipantRepository;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.lendingmarket.backend.modules.loan.presentation.dto.InviteLendersResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.LenderInvitationRequest;
import com.lendingmarket.backend.modules.loan.presentation.dto.LoanDtoMapper;
import com.lendingmarket.backend.modules.loan.presentation.dto.ParticipantResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Adds lenders to a loan. A batch is applied completely or not at all.
 */
@Service
@Transactional
public class LenderInvitationService {

    private static final Logger log = LoggerFactory.getLogger(LenderInvitationService.class);

    private final LoanRepository loanRepository;
    private final LoanParticipantRepository loanParticipantRepository;
    private final EmailInvitationRepository emailInvitationRepository;
    private final UserAccountRepository userAccountRepository;
    private final UserCapabilityService userCapabilityService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public LenderInvitationService(
            LoanRepository loanRepository,
            LoanParticipantRepository loanParticipantRepository,
            EmailInvitationRepository emailInvitationRepository,
            UserAccountRepository userAccountRepository,
            UserCapabilityService userCapabilityService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.loanRepository = loanRepository;
        this.loanParticipantRepository = loanParticipantRepository;
        this.emailInvitationRepository = emailInvitationRepository;
        this.userAccountRepository = userAccountRepository;
        this.userCapabilityService = userCapabilityService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public InviteLendersResponse inviteLenders(UUID loanId, UUID borrowerId, List<LenderInvitationRequest> lenders) {
        UserAccount borrower = userCapabilityService.requireCapability(borrowerId, Capability.BORROWER);
        Map<String, BigDecimal> batch = normalizeBatch(lenders, borrower.getEmail());

        Loan loan = loanRepository.findByIdForUpdate(loanId)
                .orElseThrow(() -> new ProblemException(ErrorCode.LOAN_NOT_FOUND, "Loan not found"));
        if (!loan.isBorrower(borrowerId)) {
            throw new ProblemException(ErrorCode.ACCESS_DENIED, "Only the borrower may invite lenders");
        }
        if (!loan.getStatus().isOpenForInvitations()) {
            throw new ProblemException(ErrorCode.LOAN_NOT_OPEN,
                    "Loan is " + loan.getStatus() + " and no longer accepts invitations");
        }

        List<String> alreadyInvited = loanParticipantRepository.findInvitedEmails(loanId, batch.keySet());
        if (!alreadyInvited.isEmpty()) {
            throw new ProblemException(ErrorCode.DUPLICATE_INVITATION,
                    "Already invited to this loan: " + String.join(", ", alreadyInvited),
                    Map.of("emails", alreadyInvited));
        }

        BigDecimal batchSum = batch.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal newTotalInvited = loan.getTotalInvited().add(batchSum);
        if (newTotalInvited.compareTo(loan.getPrincipal()) > 0) {
            log.debug("Rejected invitation batch on loan {}: {} + {} exceeds principal {}",
                    loanId, loan.getTotalInvited(), batchSum, loan.getPrincipal());
            throw new ProblemException(ErrorCode.INVALID_AMOUNT,
                    "Invitations would exceed the loan principal; remaining amount is " + loan.remainingAmount());
        }

        Map<String, UserAccount> existingUsers = userAccountRepository.findByEmailsIgnoreCase(batch.keySet()).stream()
                .collect(Collectors.toMap(user -> AuthService.normalizeEmail(user.getEmail()), Function.identity()));

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<LoanParticipant> created = new ArrayList<>();
        List<String> unregistered = new ArrayList<>();
        for (Map.Entry<String, BigDecimal> entry : batch.entrySet()) {
            String email = entry.getKey();
            UserAccount existing = existingUsers.get(email);

            LoanParticipant participant = new LoanParticipant();
            participant.setLoan(loan);
            participant.setInviteeEmail(email);
            participant.setAllocation(entry.getValue());
            participant.setRemainingBalance(entry.getValue());
            participant.setTotalRepaid(BigDecimal.ZERO);
            participant.setStatus(ParticipantStatus.PENDING);
            participant.setInvitedAt(now);
            if (existing != null) {
                participant.setLender(existing);
                userCapabilityService.grant(existing, Capability.LENDER);
            } else {
                unregistered.add(email);
            }
            created.add(participant);
        }

        loanParticipantRepository.saveAll(created);
        for (String email : unregistered) {
            if (emailInvitationRepository.insertPendingIfAbsent(UUID.randomUUID(), email, borrowerId, now) == 0) {
                log.debug("Email invitation for {} already pending", email);
            }
        }

        loan.setTotalInvited(newTotalInvited);
        loanRepository.save(loan);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("emails", new ArrayList<>(batch.keySet()));
        detail.put("batchAmount", batchSum);
        detail.put("totalInvited", newTotalInvited);
        auditLogService.record(new AuditLogCommand(
                "LENDERS_INVITED",
                "LOAN",
                loanId.toString(),
                borrowerId,
                detail
        ));
        log.info("Invited {} lender(s) to loan {} for {}", created.size(), loanId, batchSum);

        List<ParticipantResponse> participants = created.stream()
                .map(participant -> LoanDtoMapper.toParticipant(participant, null))
                .toList();
        return new InviteLendersResponse(loanId, created.size(), loan.getTotalInvited(), loan.remainingAmount(),
                participants);
    }

    /**
     * Lower-cases emails, rejects duplicates, self-invitations and non-positive amounts. Preserves batch order.
     */
    private Map<String, BigDecimal> normalizeBatch(List<LenderInvitationRequest> lenders, String borrowerEmail) {
        if (lenders == null || lenders.isEmpty()) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "At least one lender is required");
        }
        Map<String, BigDecimal> batch = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (LenderInvitationRequest lender : lenders) {
            String email = AuthService.normalizeEmail(lender.email());
            if (email == null || email.isEmpty() || !email.contains("@")) {
                throw new ProblemException(ErrorCode.VALIDATION_ERROR, "Each lender needs a valid email");
            }
            if (email.equalsIgnoreCase(borrowerEmail)) {
                throw new ProblemException(ErrorCode.VALIDATION_ERROR, "Borrowers cannot invite themselves");
            }
            BigDecimal amount = lender.amount();
            if (amount == null || amount.signum() <= 0 || amount.scale() > 2) {
                throw new ProblemException(ErrorCode.INVALID_AMOUNT,
                        "Invitation amount must be positive with at most 2 decimal places");
            }
            if (batch.putIfAbsent(email, amount) != null) {
                duplicates.add(email);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ProblemException(ErrorCode.DUPLICATE_INVITATION,
                    "Duplicate emails in batch: " + String.join(", ", duplicates),
                    Map.of("emails", new ArrayList<>(duplicates)));
        }
        return batch;
    }
}
