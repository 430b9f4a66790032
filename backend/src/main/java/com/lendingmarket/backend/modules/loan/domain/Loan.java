package com.lendingmarket.backend.modules.loan.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lendingmarket.backend.global.jpa.AbstractTimestampedEntity;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A borrower's funding request. Running totals satisfy
 * {@code 0 <= totalFunded <= totalInvited <= principal}; the table carries the same check constraint.
 */
@Entity
@Table(name = "loan")
public class Loan extends AbstractTimestampedEntity {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "borrower_id", nullable = false, updatable = false)
    private UserAccount borrower;

    @Column(name = "loan_name", nullable = false, length = 120)
    private String loanName;

    @Column(name = "principal", nullable = false, precision = 14, scale = 2)
    private BigDecimal principal;

    @Column(name = "interest_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal interestRate;

    @Column(name = "purpose", nullable = false, length = 100)
    private String purpose;

    @Column(name = "description", nullable = false, columnDefinition = "text")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_frequency", nullable = false, length = 16)
    private PaymentFrequency paymentFrequency;

    @Column(name = "term_length_months", nullable = false)
    private int termLengthMonths;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "maturity_date", nullable = false)
    private LocalDate maturityDate;

    @Column(name = "total_payments", nullable = false)
    private int totalPayments;

    @Column(name = "entity_name", length = 200)
    private String entityName;

    @Column(name = "entity_type", length = 32)
    private String entityType;

    @Column(name = "entity_tax_id", length = 50)
    private String entityTaxId;

    @Column(name = "borrower_relationship", length = 32)
    private String borrowerRelationship;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private LoanStatus status;

    @Column(name = "total_invited", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalInvited = BigDecimal.ZERO;

    @Column(name = "total_funded", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalFunded = BigDecimal.ZERO;

    @Column(name = "total_repaid", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalRepaid = BigDecimal.ZERO;

    @Column(name = "activated_at")
    private OffsetDateTime activatedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    public UUID getId() {
        return id;
    }

    public UserAccount getBorrower() {
        return borrower;
    }

    public void setBorrower(UserAccount borrower) {
        this.borrower = borrower;
    }

    public String getLoanName() {
        return loanName;
    }

    public void setLoanName(String loanName) {
        this.loanName = loanName;
    }

    public BigDecimal getPrincipal() {
        return principal;
    }

    public void setPrincipal(BigDecimal principal) {
        this.principal = principal;
    }

    public BigDecimal getInterestRate() {
        return interestRate;
    }

    public void setInterestRate(BigDecimal interestRate) {
        this.interestRate = interestRate;
    }

    public String getPurpose() {
        return purpose;
    }

    public void setPurpose(String purpose) {
        this.purpose = purpose;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public PaymentFrequency getPaymentFrequency() {
        return paymentFrequency;
    }

    public void setPaymentFrequency(PaymentFrequency paymentFrequency) {
        this.paymentFrequency = paymentFrequency;
    }

    public int getTermLengthMonths() {
        return termLengthMonths;
    }

    public void setTermLengthMonths(int termLengthMonths) {
        this.termLengthMonths = termLengthMonths;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getMaturityDate() {
        return maturityDate;
    }

    public void setMaturityDate(LocalDate maturityDate) {
        this.maturityDate = maturityDate;
    }

    public int getTotalPayments() {
        return totalPayments;
    }

    public void setTotalPayments(int totalPayments) {
        this.totalPayments = totalPayments;
    }

    public String getEntityName() {
        return entityName;
    }

    public void setEntityName(String entityName) {
        this.entityName = entityName;
    }

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public String getEntityTaxId() {
        return entityTaxId;
    }

    public void setEntityTaxId(String entityTaxId) {
        this.entityTaxId = entityTaxId;
    }

    public String getBorrowerRelationship() {
        return borrowerRelationship;
    }

    public void setBorrowerRelationship(String borrowerRelationship) {
        this.borrowerRelationship = borrowerRelationship;
    }

    public LoanStatus getStatus() {
        return status;
    }

    public void setStatus(LoanStatus status) {
        this.status = status;
    }

    public BigDecimal getTotalInvited() {
        return totalInvited;
    }

    public void setTotalInvited(BigDecimal totalInvited) {
        this.totalInvited = totalInvited;
    }

    public BigDecimal getTotalFunded() {
        return totalFunded;
    }

    public void setTotalFunded(BigDecimal totalFunded) {
        this.totalFunded = totalFunded;
    }

    public BigDecimal getTotalRepaid() {
        return totalRepaid;
    }

    public void setTotalRepaid(BigDecimal totalRepaid) {
        this.totalRepaid = totalRepaid;
    }

    public OffsetDateTime getActivatedAt() {
        return activatedAt;
    }

    public void setActivatedAt(OffsetDateTime activatedAt) {
        this.activatedAt = activatedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public boolean isBorrower(UUID userId) {
        return borrower != null && borrower.getId() != null && borrower.getId().equals(userId);
    }

    public boolean isFullyFunded() {
        return totalFunded.compareTo(principal) == 0;
    }

    /**
     * Principal not yet covered by an outstanding or accepted invitation.
     */
    public BigDecimal remainingAmount() {
        return principal.subtract(totalInvited);
    }

    public BigDecimal fundingPercentage() {
        if (principal.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return totalFunded.multiply(HUNDRED).divide(principal, 2, RoundingMode.HALF_UP);
    }
}
