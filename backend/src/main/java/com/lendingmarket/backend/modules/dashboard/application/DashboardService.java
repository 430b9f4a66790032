package com.lendingmarket.backend.modules.dashboard.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.lendingmarket.backend.modules.auth.application.UserCapabilityService;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.dashboard.presentation.dto.DashboardResponse;
import com.lendingmarket.backend.modules.dashboard.presentation.dto.DashboardResponse.BorrowerStats;
import com.lendingmarket.backend.modules.dashboard.presentation.dto.DashboardResponse.LenderStats;
import com.lendingmarket.backend.modules.dashboard.presentation.dto.LenderPortfolioResponse;
import com.lendingmarket.backend.modules.dashboard.presentation.dto.LenderPortfolioResponse.PortfolioItem;
import com.lendingmarket.backend.modules.dashboard.presentation.dto.LenderPortfolioResponse.PortfolioSummary;
import com.lendingmarket.backend.modules.loan.domain.Loan;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.domain.LoanStatus;
import com.lendingmarket.backend.modules.loan.domain.ParticipantStatus;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanParticipantRepository;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class DashboardService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private final UserCapabilityService userCapabilityService;
    private final LoanRepository loanRepository;
    private final LoanParticipantRepository loanParticipantRepository;

    public DashboardService(
            UserCapabilityService userCapabilityService,
            LoanRepository loanRepository,
            LoanParticipantRepository loanParticipantRepository
    ) {
        this.userCapabilityService = userCapabilityService;
        this.loanRepository = loanRepository;
        this.loanParticipantRepository = loanParticipantRepository;
    }

    public DashboardResponse getDashboard(UUID userId) {
        userCapabilityService.requireActiveUser(userId);
        Set<Capability> capabilities = userCapabilityService.activeCapabilities(userId);
        BorrowerStats borrower = capabilities.contains(Capability.BORROWER) ? borrowerStats(userId) : null;
        LenderStats lender = capabilities.contains(Capability.LENDER) ? lenderStats(userId) : null;
        return new DashboardResponse(borrower, lender);
    }

    /**
     * Totals and the average rate cover ACTIVE loans only; pending requests are loans still raising funds.
     */
    BorrowerStats borrowerStats(UUID borrowerId) {
        int activeLoans = 0;
        int pendingRequests = 0;
        BigDecimal totalBorrowed = BigDecimal.ZERO;
        BigDecimal rateSum = BigDecimal.ZERO;
        for (Loan loan : loanRepository.findByBorrowerIdOrderByCreatedAtDesc(borrowerId)) {
            if (loan.getStatus() == LoanStatus.ACTIVE) {
                activeLoans++;
                totalBorrowed = totalBorrowed.add(loan.getPrincipal());
                rateSum = rateSum.add(loan.getInterestRate());
            } else if (loan.getStatus() == LoanStatus.PENDING) {
                pendingRequests++;
            }
        }
        BigDecimal averageRate = activeLoans == 0
                ? BigDecimal.ZERO
                : rateSum.divide(BigDecimal.valueOf(activeLoans), 2, RoundingMode.HALF_UP);
        return new BorrowerStats(activeLoans, totalBorrowed, pendingRequests, averageRate);
    }

    /**
     * Expected returns are one year of simple interest on each allocation in an ACTIVE loan.
     */
    LenderStats lenderStats(UUID lenderId) {
        int pendingInvitations = 0;
        int activeInvestments = 0;
        BigDecimal totalLent = BigDecimal.ZERO;
        BigDecimal expectedReturns = BigDecimal.ZERO;
        BigDecimal outstanding = BigDecimal.ZERO;
        for (LoanParticipant participant : loanParticipantRepository.findByLenderWithLoan(lenderId)) {
            if (participant.getStatus() == ParticipantStatus.PENDING) {
                pendingInvitations++;
            } else if (participant.getStatus() == ParticipantStatus.ACCEPTED) {
                activeInvestments++;
                totalLent = totalLent.add(participant.getAllocation());
                outstanding = outstanding.add(participant.getRemainingBalance().max(BigDecimal.ZERO));
                Loan loan = participant.getLoan();
                if (loan.getStatus() == LoanStatus.ACTIVE) {
                    expectedReturns = expectedReturns.add(participant.getAllocation()
                            .multiply(loan.getInterestRate())
                            .divide(HUNDRED, 2, RoundingMode.HALF_UP));
                }
            }
        }
        return new LenderStats(pendingInvitations, activeInvestments, totalLent, expectedReturns, outstanding);
    }

    /**
     * Every participation of the lender, newest invitation first. Summary figures count ACCEPTED
     * participations only, plus the number still PENDING.
     */
    public LenderPortfolioResponse getLenderPortfolio(UUID lenderId) {
        userCapabilityService.requireCapability(lenderId, Capability.LENDER);

        List<PortfolioItem> items = new ArrayList<>();
        BigDecimal totalInvested = BigDecimal.ZERO;
        BigDecimal totalExpectedReturns = BigDecimal.ZERO;
        int pendingInvitations = 0;
        int activeInvestments = 0;
        for (LoanParticipant participant : loanParticipantRepository.findPortfolioByLender(lenderId)) {
            Loan loan = participant.getLoan();
            BigDecimal annualReturn = participant.getAllocation()
                    .multiply(loan.getInterestRate())
                    .divide(HUNDRED, 2, RoundingMode.HALF_UP);
            items.add(new PortfolioItem(
                    loan.getId(),
                    participant.getId(),
                    loan.getLoanName(),
                    loan.getBorrower().getDisplayName(),
                    loan.getPrincipal(),
                    participant.getAllocation(),
                    loan.getInterestRate(),
                    loan.getPurpose(),
                    loan.getDescription(),
                    loan.getPaymentFrequency().name(),
                    loan.getTermLengthMonths(),
                    loan.getStartDate(),
                    loan.getMaturityDate(),
                    loan.getTotalPayments(),
                    loan.getStatus().name(),
                    participant.getStatus().name(),
                    participant.getInvitedAt(),
                    participant.getRespondedAt(),
                    loan.getTotalFunded(),
                    loan.fundingPercentage(),
                    participant.getRemainingBalance(),
                    annualReturn,
                    annualReturn.divide(MONTHS_PER_YEAR, 2, RoundingMode.HALF_UP)
            ));

            if (participant.getStatus() == ParticipantStatus.PENDING) {
                pendingInvitations++;
            } else if (participant.getStatus() == ParticipantStatus.ACCEPTED) {
                totalInvested = totalInvested.add(participant.getAllocation());
                totalExpectedReturns = totalExpectedReturns.add(annualReturn);
                if (loan.getStatus() == LoanStatus.ACTIVE) {
                    activeInvestments++;
                }
            }
        }
        return new LenderPortfolioResponse(items, items.size(),
                new PortfolioSummary(totalInvested, totalExpectedReturns, pendingInvitations, activeInvestments));
    }
}
