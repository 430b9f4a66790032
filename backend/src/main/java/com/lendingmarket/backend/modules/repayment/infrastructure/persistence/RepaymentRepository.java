package com.lendingmarket.backend.modules.repayment.infrastructure.persistence;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lendingmarket.backend.modules.repayment.domain.Repayment;
import com.lendingmarket.backend.modules.repayment.domain.RepaymentStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RepaymentRepository extends JpaRepository<Repayment, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Repayment r where r.id = :id")
    Optional<Repayment> findByIdForUpdate(@Param("id") UUID id);

    @Query("select r.loan.id from Repayment r where r.id = :id")
    Optional<UUID> findLoanIdByRepaymentId(@Param("id") UUID id);

    @Query("""
            select r from Repayment r
              join fetch r.loan l
              join fetch l.borrower
              join fetch r.participant p
              left join fetch p.lender
             where r.id = :id
            """)
    Optional<Repayment> findByIdWithContext(@Param("id") UUID id);

    /**
     * Null when no repayment matches.
     */
    @Query("""
            select sum(r.amount) from Repayment r
             where r.participant.id = :participantId
               and r.status = :status
            """)
    BigDecimal sumAmountByParticipantAndStatus(@Param("participantId") UUID participantId,
                                               @Param("status") RepaymentStatus status);

    @Query("""
            select r from Repayment r
              join fetch r.loan l
              join fetch l.borrower
              join fetch r.participant p
              left join fetch p.lender
             where p.lender.id = :lenderId
               and r.status = com.lendingmarket.backend.modules.repayment.domain.RepaymentStatus.PENDING
             order by r.createdAt desc
            """)
    List<Repayment> findPendingForLender(@Param("lenderId") UUID lenderId);

    @Query("""
            select r from Repayment r
              join fetch r.loan l
              join fetch l.borrower
              join fetch r.participant p
              left join fetch p.lender
             where r.status = com.lendingmarket.backend.modules.repayment.domain.RepaymentStatus.PENDING
             order by r.createdAt desc
            """)
    List<Repayment> findAllPending();

    @Query("""
            select r from Repayment r
              join fetch r.loan l
              join fetch l.borrower
              join fetch r.participant p
              left join fetch p.lender
             where l.id = :loanId
             order by r.createdAt desc
            """)
    List<Repayment> findByLoanIdWithContext(@Param("loanId") UUID loanId);
}
