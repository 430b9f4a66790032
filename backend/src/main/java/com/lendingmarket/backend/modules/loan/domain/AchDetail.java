package com.lendingmarket.backend.modules.loan.domain;

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
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Banking details a lender supplies on acceptance. Stored for the borrower's reference only.
 */
@Entity
@Table(name = "ach_detail")
public class AchDetail extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "participant_id", nullable = false, updatable = false, unique = true)
    private LoanParticipant participant;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "loan_id", nullable = false, updatable = false)
    private Loan loan;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lender_user_id", nullable = false, updatable = false)
    private UserAccount lender;

    @Column(name = "bank_name", nullable = false, length = 100)
    private String bankName;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 16)
    private AchAccountType accountType;

    @Column(name = "routing_number", nullable = false, length = 9)
    private String routingNumber;

    @Column(name = "account_number", nullable = false, length = 17)
    private String accountNumber;

    @Column(name = "special_instructions", length = 500)
    private String specialInstructions;

    public UUID getId() {
        return id;
    }

    public LoanParticipant getParticipant() {
        return participant;
    }

    public void setParticipant(LoanParticipant participant) {
        this.participant = participant;
    }

    public Loan getLoan() {
        return loan;
    }

    public void setLoan(Loan loan) {
        this.loan = loan;
    }

    public UserAccount getLender() {
        return lender;
    }

    public void setLender(UserAccount lender) {
        this.lender = lender;
    }

    public String getBankName() {
        return bankName;
    }

    public void setBankName(String bankName) {
        this.bankName = bankName;
    }

    public AchAccountType getAccountType() {
        return accountType;
    }

    public void setAccountType(AchAccountType accountType) {
        this.accountType = accountType;
    }

    public String getRoutingNumber() {
        return routingNumber;
    }

    public void setRoutingNumber(String routingNumber) {
        this.routingNumber = routingNumber;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public void setAccountNumber(String accountNumber) {
        this.accountNumber = accountNumber;
    }

    public String getSpecialInstructions() {
        return specialInstructions;
    }

    public void setSpecialInstructions(String specialInstructions) {
        this.specialInstructions = specialInstructions;
    }
}
