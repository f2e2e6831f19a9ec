package com.church.chms.controller;

import com.church.chms.dto.BudgetVsActual;
import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.IncomeStatement;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.FinanceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 财务报表接口
 */
@RestController
@RequestMapping("/api/finance")
@RequiresPermission("view_financial_reports")
public class FinanceController {

    private final FinanceService financeService;

    public FinanceController(FinanceService financeService) {
        this.financeService = financeService;
    }

    @GetMapping("/income-statement/{fiscal_year_id}")
    public ResponseEntity<CommonResponse<IncomeStatement>> getIncomeStatement(
            @PathVariable("fiscal_year_id") Long fiscalYearId) {
        return ResponseEntity.ok(CommonResponse.success(financeService.getIncomeStatement(fiscalYearId)));
    }

    @GetMapping("/budget-vs-actual/{fiscal_year_id}")
    public ResponseEntity<CommonResponse<BudgetVsActual>> getBudgetVsActual(
            @PathVariable("fiscal_year_id") Long fiscalYearId) {
        return ResponseEntity.ok(CommonResponse.success(financeService.getBudgetVsActual(fiscalYearId)));
    }
}
