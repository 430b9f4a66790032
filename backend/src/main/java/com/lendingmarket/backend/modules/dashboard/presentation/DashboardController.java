package com.lendingmarket.backend.modules.dashboard.presentation;

import com.lendingmarket.backend.global.security.JwtAuthenticationPrincipal;
import com.lendingmarket.backend.modules.dashboard.application.DashboardService;
import com.lendingmarket.backend.modules.dashboard.presentation.dto.DashboardResponse;
import com.lendingmarket.backend.modules.dashboard.presentation.dto.LenderPortfolioResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/user")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardResponse> dashboard(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(dashboardService.getDashboard(principal.userId()));
    }

    @GetMapping("/lender-portfolio")
    public ResponseEntity<LenderPortfolioResponse> lenderPortfolio(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(dashboardService.getLenderPortfolio(principal.userId()));
    }
}
