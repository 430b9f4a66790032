package com.lendingmarket.backend.modules.loan.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.lendingmarket.backend.global.config.LendingProperties;
import com.lendingmarket.backend.global.error.ErrorCode;
import com.lendingmarket.backend.global.error.ProblemException;
import com.lendingmarket.backend.modules.audit.application.AuditLogService;
import com.lendingmarket.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.lendingmarket.backend.modules.auth.application.UserCapabilityService;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.loan.domain.AchDetail;
import com.lendingmarket.backend.modules.loan.domain.Loan;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.domain.LoanStatus;
import com.lendingmarket.backend.modules.loan.domain.LoanTermsCalculator;
import com.lendingmarket.backend.modules.loan.domain.ParticipantStatus;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.AchDetailRepository;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanParticipantRepository;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.lendingmarket.backend.modules.loan.presentation.dto.CreateLoanRequest;
import com.lendingmarket.backend.modules.loan.presentation.dto.EntityDetailsRequest;
import com.lendingmarket.backend.modules.loan.presentation.dto.LoanDetailsResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.LoanDtoMapper;
import com.lendingmarket.backend.modules.loan.presentation.dto.LoanSummaryResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.ParticipantResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class LoanService {

    private static final Logger log = LoggerFactory.getLogger(LoanService.class);
    private static final String BUSINESS_PURPOSE = "business";

    private final LoanRepository loanRepository;
    private final LoanParticipantRepository loanParticipantRepository;
    private final AchDetailRepository achDetailRepository;
    private final LenderInvitationService lenderInvitationService;
    private final UserCapabilityService userCapabilityService;
    private final AuditLogService auditLogService;
    private final LendingProperties lendingProperties;
    private final Clock clock;

    public LoanService(
            LoanRepository loanRepository,
            LoanParticipantRepository loanParticipantRepository,
            AchDetailRepository achDetailRepository,
            LenderInvitationService lenderInvitationService,
            UserCapabilityService userCapabilityService,
            AuditLogService auditLogService,
            LendingProperties lendingProperties,
            Clock clock
    ) {
        this.loanRepository = loanRepository;
        this.loanParticipantRepository = loanParticipantRepository;
        this.achDetailRepository = achDetailRepository;
        this.lenderInvitationService = lenderInvitationService;
        this.userCapabilityService = userCapabilityService;
        this.auditLogService = auditLogService;
        this.lendingProperties = lendingProperties;
        this.clock = clock;
    }

    /**
     * Opens a loan for funding. An initial lender batch, when present, is invited in the same transaction.
     */
    public LoanDetailsResponse createLoan(UUID borrowerId, CreateLoanRequest request) {
        UserAccount borrower = userCapabilityService.requireCapability(borrowerId, Capability.BORROWER);
        validateTerms(request);

        int termLengthMonths = request.termLengthMonths();
        int totalPayments = LoanTermsCalculator.totalPayments(request.paymentFrequency(), termLengthMonths);
        if (totalPayments < 1) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR,
                    "Term of " + termLengthMonths + " month(s) is too short for " + request.paymentFrequency()
                            + " payments");
        }

        Loan loan = new Loan();
        loan.setBorrower(borrower);
        loan.setLoanName(request.loanName().trim());
        loan.setPrincipal(request.principal());
        loan.setInterestRate(request.interestRate());
        loan.setPurpose(request.purpose().trim());
        loan.setDescription(request.description().trim());
        loan.setPaymentFrequency(request.paymentFrequency());
        loan.setTermLengthMonths(termLengthMonths);
        loan.setStartDate(request.startDate());
        loan.setMaturityDate(LoanTermsCalculator.maturityDate(request.startDate(), termLengthMonths));
        loan.setTotalPayments(totalPayments);
        applyEntityDetails(loan, request.entityDetails());
        loan.setStatus(LoanStatus.PENDING);
        loan.setTotalInvited(BigDecimal.ZERO);
        loan.setTotalFunded(BigDecimal.ZERO);
        loan.setTotalRepaid(BigDecimal.ZERO);
        loan = loanRepository.saveAndFlush(loan);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("principal", loan.getPrincipal());
        detail.put("interestRate", loan.getInterestRate());
        detail.put("termLengthMonths", termLengthMonths);
        auditLogService.record(new AuditLogCommand(
                "LOAN_CREATED",
                "LOAN",
                loan.getId().toString(),
                borrowerId,
                detail
        ));
        log.info("Created loan {} for borrower {} with principal {}", loan.getId(), borrowerId, loan.getPrincipal());

        if (request.lenders() != null && !request.lenders().isEmpty()) {
            lenderInvitationService.inviteLenders(loan.getId(), borrowerId, request.lenders());
        }

        return buildBorrowerView(loan, LoanDetailsResponse.VIEWER_BORROWER);
    }

    @Transactional(readOnly = true)
    public LoanDetailsResponse getLoanDetails(UUID loanId, UUID requesterId) {
        UserAccount requester = userCapabilityService.requireActiveUser(requesterId);
        Loan loan = loanRepository.findByIdWithBorrower(loanId)
                .orElseThrow(() -> new ProblemException(ErrorCode.LOAN_NOT_FOUND, "Loan not found"));

        if (loan.isBorrower(requesterId)) {
            return buildBorrowerView(loan, LoanDetailsResponse.VIEWER_BORROWER);
        }

        List<LoanParticipant> participants = loanParticipantRepository.findByLoanIdWithLender(loanId);
        LoanParticipant own = participants.stream()
                .filter(participant -> participant.isOwnedBy(requesterId, requester.getEmail()))
                .findFirst()
                .orElse(null);
        if (own == null) {
            if (userCapabilityService.hasCapability(requesterId, Capability.ADMIN)) {
                return buildBorrowerView(loan, LoanDetailsResponse.VIEWER_ADMIN);
            }
            throw new ProblemException(ErrorCode.ACCESS_DENIED, "Not a participant of this loan");
        }

        AchDetail ownAch = own.getStatus() == ParticipantStatus.ACCEPTED
                ? achDetailRepository.findByParticipantId(own.getId()).orElse(null)
                : null;
        return new LoanDetailsResponse(
                LoanDtoMapper.toSummary(loan, participants),
                LoanDetailsResponse.VIEWER_LENDER,
                List.of(LoanDtoMapper.toParticipant(own, ownAch)),
                paymentSchedule(loan),
                LoanTermsCalculator.amortizationSchedule(own.getAllocation(), loan.getInterestRate(),
                        loan.getPaymentFrequency(), loan.getStartDate(), loan.getTotalPayments())
        );
    }

    @Transactional(readOnly = true)
    public List<LoanSummaryResponse> listBorrowerLoans(UUID borrowerId) {
        userCapabilityService.requireActiveUser(borrowerId);
        return loanRepository.findByBorrowerIdOrderByCreatedAtDesc(borrowerId).stream()
                .map(loan -> LoanDtoMapper.toSummary(loan, loanParticipantRepository.findByLoanIdWithLender(loan.getId())))
                .toList();
    }

    private LoanDetailsResponse buildBorrowerView(Loan loan, String viewerRole) {
        List<LoanParticipant> participants = loanParticipantRepository.findByLoanIdWithLender(loan.getId());
        List<UUID> acceptedIds = participants.stream()
                .filter(participant -> participant.getStatus() == ParticipantStatus.ACCEPTED)
                .map(LoanParticipant::getId)
                .toList();
        Map<UUID, AchDetail> achByParticipant = acceptedIds.isEmpty()
                ? Map.of()
                : achDetailRepository.findByParticipantIds(acceptedIds).stream()
                        .collect(Collectors.toMap(ach -> ach.getParticipant().getId(), Function.identity()));

        List<ParticipantResponse> participantResponses = participants.stream()
                .map(participant -> LoanDtoMapper.toParticipant(participant, achByParticipant.get(participant.getId())))
                .toList();
        return new LoanDetailsResponse(
                LoanDtoMapper.toSummary(loan, participants),
                viewerRole,
                participantResponses,
                paymentSchedule(loan),
                null
        );
    }

    private List<LocalDate> paymentSchedule(Loan loan) {
        return LoanTermsCalculator.paymentSchedule(loan.getStartDate(), loan.getPaymentFrequency(),
                loan.getTotalPayments());
    }

    private void validateTerms(CreateLoanRequest request) {
        LendingProperties.Loan limits = lendingProperties.loan();

        BigDecimal principal = request.principal();
        if (principal == null || principal.signum() <= 0
                || principal.compareTo(limits.minPrincipal()) < 0
                || principal.compareTo(limits.maxPrincipal()) > 0) {
            throw new ProblemException(ErrorCode.INVALID_AMOUNT,
                    "Principal must be between " + limits.minPrincipal() + " and " + limits.maxPrincipal());
        }

        BigDecimal rate = request.interestRate();
        if (rate == null || rate.compareTo(limits.minInterestRate()) < 0 || rate.compareTo(limits.maxInterestRate()) > 0) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR,
                    "Interest rate must be between " + limits.minInterestRate() + " and " + limits.maxInterestRate());
        }

        String description = request.description() == null ? "" : request.description().trim();
        if (description.length() < limits.minDescriptionLength()) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR,
                    "Description must be at least " + limits.minDescriptionLength() + " characters");
        }

        Integer term = request.termLengthMonths();
        if (term == null || term < 1 || term > 60) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "Term length must be between 1 and 60 months");
        }

        if (request.startDate() == null || request.startDate().isBefore(LocalDate.now(clock))) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "Start date cannot be in the past");
        }

        if (BUSINESS_PURPOSE.equalsIgnoreCase(request.purpose().trim())) {
            EntityDetailsRequest entity = request.entityDetails();
            if (entity == null || !StringUtils.hasText(entity.entityName())
                    || !StringUtils.hasText(entity.entityType())
                    || !StringUtils.hasText(entity.borrowerRelationship())) {
                throw new ProblemException(ErrorCode.VALIDATION_ERROR,
                        "Business loans require entity name, entity type and borrower relationship");
            }
        }
    }

    private void applyEntityDetails(Loan loan, EntityDetailsRequest entity) {
        if (entity == null) {
            return;
        }
        loan.setEntityName(trimToNull(entity.entityName()));
        loan.setEntityType(trimToNull(entity.entityType()));
        loan.setEntityTaxId(trimToNull(entity.entityTaxId()));
        loan.setBorrowerRelationship(trimToNull(entity.borrowerRelationship()));
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
