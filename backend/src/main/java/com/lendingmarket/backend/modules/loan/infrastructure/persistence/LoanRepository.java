package com.lendingmarket.backend.modules.loan.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lendingmarket.backend.modules.loan.domain.Loan;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoanRepository extends JpaRepository<Loan, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from Loan l where l.id = :id")
    Optional<Loan> findByIdForUpdate(@Param("id") UUID id);

    @Query("select l from Loan l join fetch l.borrower where l.id = :id")
    Optional<Loan> findByIdWithBorrower(@Param("id") UUID id);

    @Query("""
            select l from Loan l
             where l.borrower.id = :borrowerId
             order by l.createdAt desc
            """)
    List<Loan> findByBorrowerIdOrderByCreatedAtDesc(@Param("borrowerId") UUID borrowerId);
}
