package com.lendingmarket.backend.modules.loan.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.domain.ParticipantStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoanParticipantRepository extends JpaRepository<LoanParticipant, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from LoanParticipant p where p.id = :id")
    Optional<LoanParticipant> findByIdForUpdate(@Param("id") UUID id);

    /**
     * The caller's participation on a loan, either already linked to the user or still keyed by email.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select p from LoanParticipant p
             where p.loan.id = :loanId
               and (p.lender.id = :userId or (p.lender is null and p.inviteeEmail = :email))
            """)
    Optional<LoanParticipant> findOwnForUpdate(@Param("loanId") UUID loanId,
                                               @Param("userId") UUID userId,
                                               @Param("email") String email);

    @Query("""
            select p from LoanParticipant p
             where p.loan.id = :loanId
               and (p.lender.id = :userId or (p.lender is null and p.inviteeEmail = :email))
            """)
    Optional<LoanParticipant> findOwn(@Param("loanId") UUID loanId,
                                      @Param("userId") UUID userId,
                                      @Param("email") String email);

    @Query("""
            select p.inviteeEmail from LoanParticipant p
             where p.loan.id = :loanId
               and p.inviteeEmail in :emails
            """)
    List<String> findInvitedEmails(@Param("loanId") UUID loanId, @Param("emails") Collection<String> emails);

    @Query("""
            select p from LoanParticipant p
              left join fetch p.lender
             where p.loan.id = :loanId
             order by p.invitedAt asc
            """)
    List<LoanParticipant> findByLoanIdWithLender(@Param("loanId") UUID loanId);

    @Query("""
            select p from LoanParticipant p
              join fetch p.loan l
              join fetch l.borrower
             where p.lender.id = :lenderId
               and p.status = :status
             order by p.invitedAt desc
            """)
    List<LoanParticipant> findByLenderAndStatus(@Param("lenderId") UUID lenderId,
                                                @Param("status") ParticipantStatus status);

    @Query("""
            select p from LoanParticipant p
              join fetch p.loan l
             where p.lender.id = :lenderId
            """)
    List<LoanParticipant> findByLenderWithLoan(@Param("lenderId") UUID lenderId);

    @Query("""
            select p from LoanParticipant p
              join fetch p.loan l
              join fetch l.borrower
             where p.lender.id = :lenderId
             order by p.invitedAt desc
            """)
    List<LoanParticipant> findPortfolioByLender(@Param("lenderId") UUID lenderId);

    @Query("select p from LoanParticipant p where p.lender is null and p.inviteeEmail = :email")
    List<LoanParticipant> findUnlinkedByEmail(@Param("email") String email);

    @Query("""
            select count(p) from LoanParticipant p
             where p.loan.id = :loanId
               and p.status = com.lendingmarket.backend.modules.loan.domain.ParticipantStatus.ACCEPTED
               and p.remainingBalance > 0
            """)
    long countOutstanding(@Param("loanId") UUID loanId);

    @Query("""
            select p from LoanParticipant p
              join fetch p.lender u
              join fetch p.loan l
             where l.borrower.id = :borrowerId
            """)
    List<LoanParticipant> findLinkedByBorrower(@Param("borrowerId") UUID borrowerId);
}
