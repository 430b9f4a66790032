package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.loan.domain.AchDetail;
import com.lendingmarket.backend.modules.loan.domain.Loan;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.domain.LoanTermsCalculator;
import com.lendingmarket.backend.modules.loan.domain.ParticipantStatus;

public final class LoanDtoMapper {

    private LoanDtoMapper() {
    }

    public static LoanSummaryResponse toSummary(Loan loan, List<LoanParticipant> participants) {
        int participantCount = participants == null ? 0 : participants.size();
        int acceptedCount = participants == null ? 0 : (int) participants.stream()
                .filter(participant -> participant.getStatus() == ParticipantStatus.ACCEPTED)
                .count();
        UserAccount borrower = loan.getBorrower();

        return new LoanSummaryResponse(
                loan.getId(),
                loan.getLoanName(),
                borrower != null ? borrower.getId() : null,
                borrower != null ? borrower.getDisplayName() : null,
                loan.getPrincipal(),
                loan.getInterestRate(),
                loan.getPurpose(),
                loan.getDescription(),
                loan.getPaymentFrequency().name(),
                loan.getTermLengthMonths(),
                loan.getStartDate(),
                loan.getMaturityDate(),
                loan.getTotalPayments(),
                loan.getStatus().name(),
                loan.getTotalInvited(),
                loan.getTotalFunded(),
                loan.getTotalRepaid(),
                loan.fundingPercentage(),
                loan.remainingAmount(),
                loan.isFullyFunded(),
                participantCount,
                acceptedCount,
                toEntityDetails(loan),
                loan.getCreatedAt(),
                loan.getActivatedAt(),
                loan.getCompletedAt()
        );
    }

    public static ParticipantResponse toParticipant(LoanParticipant participant, AchDetail achDetail) {
        UserAccount lender = participant.getLender();
        return new ParticipantResponse(
                participant.getId(),
                lender != null ? lender.getId() : null,
                participant.getInviteeEmail(),
                lender != null ? lender.getDisplayName() : null,
                participant.getAllocation(),
                participant.getRemainingBalance(),
                participant.getTotalRepaid(),
                participant.getStatus().name(),
                participant.getInvitedAt(),
                participant.getRespondedAt(),
                estimate(participant.getLoan(), participant.getAllocation()),
                achDetail != null ? toAchDetail(achDetail) : null
        );
    }

    public static PendingInvitationResponse toPendingInvitation(LoanParticipant participant) {
        Loan loan = participant.getLoan();
        return new PendingInvitationResponse(
                participant.getId(),
                loan.getId(),
                loan.getLoanName(),
                loan.getBorrower().getDisplayName(),
                loan.getPrincipal(),
                loan.getInterestRate(),
                loan.getPurpose(),
                loan.getPaymentFrequency().name(),
                loan.getTermLengthMonths(),
                loan.getStartDate(),
                loan.getStatus().name(),
                loan.fundingPercentage(),
                participant.getAllocation(),
                estimate(loan, participant.getAllocation()),
                participant.getInvitedAt()
        );
    }

    public static InvitationDecisionResponse toDecision(LoanParticipant participant) {
        Loan loan = participant.getLoan();
        return new InvitationDecisionResponse(
                loan.getId(),
                participant.getId(),
                participant.getStatus().name(),
                loan.getStatus().name(),
                loan.getTotalInvited(),
                loan.getTotalFunded(),
                loan.fundingPercentage(),
                loan.isFullyFunded()
        );
    }

    public static AchDetailResponse toAchDetail(AchDetail achDetail) {
        return new AchDetailResponse(
                achDetail.getBankName(),
                achDetail.getAccountType().name().toLowerCase(Locale.ROOT),
                achDetail.getRoutingNumber(),
                achDetail.getAccountNumber(),
                achDetail.getSpecialInstructions()
        );
    }

    public static PaymentEstimateResponse estimate(Loan loan, BigDecimal contribution) {
        if (loan == null || contribution == null || loan.getTotalPayments() <= 0) {
            return null;
        }
        int payments = loan.getTotalPayments();
        BigDecimal payment = LoanTermsCalculator.periodicPayment(
                contribution, loan.getInterestRate(), loan.getPaymentFrequency(), payments);
        BigDecimal totalRepayment = LoanTermsCalculator.totalRepayable(payment, payments);
        return new PaymentEstimateResponse(
                payment,
                payments,
                totalRepayment,
                totalRepayment.subtract(contribution)
        );
    }

    private static EntityDetailsResponse toEntityDetails(Loan loan) {
        if (loan.getEntityName() == null && loan.getEntityType() == null
                && loan.getEntityTaxId() == null && loan.getBorrowerRelationship() == null) {
            return null;
        }
        return new EntityDetailsResponse(
                loan.getEntityName(),
                loan.getEntityType(),
                loan.getEntityTaxId(),
                loan.getBorrowerRelationship()
        );
    }
}
