package com.lendingmarket.backend.modules.loan.presentation;

import java.util.List;
import java.util.UUID;

import com.lendingmarket.backend.global.security.JwtAuthenticationPrincipal;
import com.lendingmarket.backend.modules.loan.application.LenderService;
import com.lendingmarket.backend.modules.loan.presentation.dto.AcceptInvitationRequest;
import com.lendingmarket.backend.modules.loan.presentation.dto.InvitationDecisionResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.LenderSearchResponse;
import com.lendingmarket.backend.modules.loan.presentation.dto.PendingInvitationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LenderController {

    private final LenderService lenderService;

    public LenderController(LenderService lenderService) {
        this.lenderService = lenderService;
    }

    @GetMapping("/lender/pending")
    public ResponseEntity<List<PendingInvitationResponse>> pendingInvitations(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(lenderService.listPendingInvitations(principal.userId()));
    }

    @Operation(
            summary = "Accept an invitation",
            description = """
                    Commits the caller's allocation and stores the ACH details used for repayments. \
                    The loan becomes ACTIVE once the accepted allocations reach the principal.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Participation accepted"),
            @ApiResponse(responseCode = "409", description = "`ALREADY_ACCEPTED`, `LOAN_NOT_OPEN` or `LOAN_FULLY_FUNDED`"),
            @ApiResponse(responseCode = "422", description = "Invalid ACH details, or the allocation would overfund the loan")
    })
    @PutMapping("/lender/accept/{loanId}")
    public ResponseEntity<InvitationDecisionResponse> accept(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID loanId,
            @RequestBody AcceptInvitationRequest request
    ) {
        return ResponseEntity.ok(lenderService.acceptInvitation(principal.userId(), loanId, request));
    }

    @PutMapping("/lender/decline/{loanId}")
    public ResponseEntity<InvitationDecisionResponse> decline(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID loanId
    ) {
        return ResponseEntity.ok(lenderService.declineInvitation(principal.userId(), loanId));
    }

    @GetMapping("/lenders/search")
    public ResponseEntity<List<LenderSearchResponse>> search(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "q", required = false) String query
    ) {
        return ResponseEntity.ok(lenderService.searchLenders(principal.userId(), query));
    }
}
