package com.church.chms.controller;

import com.church.chms.dto.BudgetCreateRequest;
import com.church.chms.dto.BudgetReviewRequest;
import com.church.chms.dto.BudgetUpdateRequest;
import com.church.chms.dto.BudgetView;
import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.BudgetService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/budgets")
public class BudgetController {

    private final BudgetService budgetService;

    public BudgetController(BudgetService budgetService) {
        this.budgetService = budgetService;
    }

    @PostMapping
    @RequiresPermission("create_budgets")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody BudgetCreateRequest request) {
        Long budgetId = budgetService.create(request);
        return ResponseEntity.ok(CommonResponse.success("Budget created", new CreatedId(budgetId)));
    }

    @PutMapping("/{budget_id}")
    @RequiresPermission("edit_budgets")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("budget_id") Long budgetId,
                                                       @Valid @RequestBody BudgetUpdateRequest request) {
        budgetService.update(budgetId, request);
        return ResponseEntity.ok(CommonResponse.success("Budget updated", null));
    }

    @DeleteMapping("/{budget_id}")
    @RequiresPermission("delete_budgets")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("budget_id") Long budgetId) {
        budgetService.delete(budgetId);
        return ResponseEntity.ok(CommonResponse.success("Budget deleted", null));
    }

    @GetMapping("/{budget_id}")
    @RequiresPermission("view_budgets")
    public ResponseEntity<CommonResponse<BudgetView>> get(@PathVariable("budget_id") Long budgetId) {
        return ResponseEntity.ok(CommonResponse.success(budgetService.get(budgetId)));
    }

    @GetMapping
    @RequiresPermission("view_budgets")
    public ResponseEntity<CommonResponse<PageResult<BudgetView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) Long fiscalYearId,
            @RequestParam(required = false) Long branchId,
            @RequestParam(required = false) String status) {
        return ResponseEntity.ok(CommonResponse.success(
                budgetService.getAll(page, limit, fiscalYearId, branchId, status)));
    }

    @PostMapping("/{budget_id}/submit")
    @RequiresPermission("edit_budgets")
    public ResponseEntity<CommonResponse<Void>> submit(@PathVariable("budget_id") Long budgetId) {
        budgetService.submit(budgetId);
        return ResponseEntity.ok(CommonResponse.success("Budget submitted", null));
    }

    @PostMapping("/{budget_id}/review")
    @RequiresPermission("approve_budgets")
    public ResponseEntity<CommonResponse<Void>> review(@PathVariable("budget_id") Long budgetId,
                                                       @Valid @RequestBody BudgetReviewRequest request) {
        budgetService.review(budgetId, request);
        return ResponseEntity.ok(CommonResponse.success("Budget reviewed", null));
    }
}
