package com.lendingmarket.backend.modules.loan.presentation;

import java.util.List;
import java.util.UUID;

import com.lendingmarket.backend.global.security.JwtAuthenticationPrincipal;
import com.lendingmarket.backend.modules.loan.application.LenderInvitationService;
import com.lendingmarket.backend.modules.loan.application.LoanService;
import com.lendingmarket.backend.modules.loan.presentation.dto.CreateLoanRequest;
import com.lendingmarket.backend.modules.loan.presentation.dto.InviteLendersRequest;
import com.lendingmarket.backend.modules.loan.presentation.dto.InviteLendersResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.LoanDetailsResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.LoanSummaryResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/loans")
public class LoanController {

    private final LoanService loanService;
    private final LenderInvitationService lenderInvitationService;

    public LoanController(LoanService loanService, LenderInvitationService lenderInvitationService) {
        this.loanService = loanService;
        this.lenderInvitationService = lenderInvitationService;
    }

    @PostMapping
    public ResponseEntity<LoanDetailsResponse> createLoan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateLoanRequest request
    ) {
        LoanDetailsResponse response = loanService.createLoan(principal.userId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/my-loans")
    public ResponseEntity<List<LoanSummaryResponse>> myLoans(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(loanService.listBorrowerLoans(principal.userId()));
    }

    @GetMapping("/{loanId}")
    public ResponseEntity<LoanDetailsResponse> getLoan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID loanId
    ) {
        return ResponseEntity.ok(loanService.getLoanDetails(loanId, principal.userId()));
    }

    @Operation(
            summary = "Invite lenders",
            description = """
                    Reserves an allocation per invitee. Unregistered emails receive an email invitation \
                    that is linked to their account on registration or login.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Invitations created"),
            @ApiResponse(responseCode = "409", description = "`DUPLICATE_INVITATION` or `LOAN_NOT_OPEN`"),
            @ApiResponse(responseCode = "422", description = "`INVALID_AMOUNT` when the batch exceeds the uninvited principal")
    })
    @PostMapping("/{loanId}/invitations")
    public ResponseEntity<InviteLendersResponse> inviteLenders(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID loanId,
            @Valid @RequestBody InviteLendersRequest request
    ) {
        InviteLendersResponse response = lenderInvitationService.inviteLenders(loanId, principal.userId(), request.lenders());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
