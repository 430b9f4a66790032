package com.lendingmarket.backend.modules.repayment.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.loan.domain.Loan;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.repayment.domain.Repayment;

public record RepaymentResponse(
        UUID repaymentId,
        UUID loanId,
        String loanName,
        String loanStatus,
        UUID borrowerId,
        String borrowerName,
        UUID participantId,
        UUID lenderId,
        String lenderName,
        String lenderEmail,
        BigDecimal amount,
        LocalDate paymentDate,
        String notes,
        String proofReference,
        String status,
        UUID reviewedBy,
        OffsetDateTime reviewedAt,
        String reviewNotes,
        BigDecimal participantRemainingBalance,
        OffsetDateTime submittedAt
) {

    public static RepaymentResponse from(Repayment repayment) {
        Loan loan = repayment.getLoan();
        LoanParticipant participant = repayment.getParticipant();
        UserAccount borrower = loan.getBorrower();
        UserAccount lender = participant.getLender();
        UserAccount reviewer = repayment.getReviewedBy();
        return new RepaymentResponse(
                repayment.getId(),
                loan.getId(),
                loan.getLoanName(),
                loan.getStatus().name(),
                borrower.getId(),
                borrower.getDisplayName(),
                participant.getId(),
                lender != null ? lender.getId() : null,
                lender != null ? lender.getDisplayName() : null,
                participant.getInviteeEmail(),
                repayment.getAmount(),
                repayment.getPaymentDate(),
                repayment.getNotes(),
                repayment.getProofReference(),
                repayment.getStatus().name(),
                reviewer != null ? reviewer.getId() : null,
                repayment.getReviewedAt(),
                repayment.getReviewNotes(),
                participant.getRemainingBalance(),
                repayment.getCreatedAt()
        );
    }
}
