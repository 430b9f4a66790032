package com.lendingmarket.backend.modules.repayment.presentation;

import java.util.List;
import java.util.UUID;

import com.lendingmarket.backend.global.security.JwtAuthenticationPrincipal;
import com.lendingmarket.backend.modules.repayment.application.RepaymentService;
import com.lendingmarket.backend.modules.repayment.presentation.dto.RepaymentResponse;
import com.lendingmarket.backend.modules.repayment.presentation.dto.ReviewRepaymentRequest;
import com.lendingmarket.backend.modules.repayment.presentation.dto.SubmitRepaymentRequest;

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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RepaymentController {

    private final RepaymentService repaymentService;

    public RepaymentController(RepaymentService repaymentService) {
        this.repaymentService = repaymentService;
    }

    @PostMapping("/repayments")
    public ResponseEntity<RepaymentResponse> submit(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody SubmitRepaymentRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(repaymentService.submitPayment(principal.userId(), request));
    }

    @Operation(summary = "Approve or reject a pending repayment")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Repayment reviewed"),
            @ApiResponse(responseCode = "409", description = "`ALREADY_REVIEWED`")
    })
    @PutMapping("/repayments/{repaymentId}")
    public ResponseEntity<RepaymentResponse> review(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID repaymentId,
            @Valid @RequestBody ReviewRepaymentRequest request
    ) {
        return ResponseEntity.ok(repaymentService.reviewPayment(repaymentId, principal.userId(), request));
    }

    @GetMapping("/repayments/pending")
    public ResponseEntity<List<RepaymentResponse>> pending(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(repaymentService.listPendingRepayments(principal.userId()));
    }

    @GetMapping("/repayments/{repaymentId}")
    public ResponseEntity<RepaymentResponse> get(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID repaymentId
    ) {
        return ResponseEntity.ok(repaymentService.getRepayment(repaymentId, principal.userId()));
    }

    @GetMapping("/loans/{loanId}/repayments")
    public ResponseEntity<List<RepaymentResponse>> byLoan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID loanId
    ) {
        return ResponseEntity.ok(repaymentService.listLoanRepayments(loanId, principal.userId()));
    }
}
