package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.ExpenseRequest;
import com.church.chms.dto.ExpenseReviewRequest;
import com.church.chms.dto.ExpenseView;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.ExpenseService;
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

import java.util.List;
import java.util.Map;

@Validated
@RestController
@RequestMapping("/api/expenses")
public class ExpenseController {

    private final ExpenseService expenseService;

    public ExpenseController(ExpenseService expenseService) {
        this.expenseService = expenseService;
    }

    @PostMapping
    @RequiresPermission("create_expense")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody ExpenseRequest request) {
        Long expenseId = expenseService.create(request);
        return ResponseEntity.ok(CommonResponse.success("Expense created", new CreatedId(expenseId)));
    }

    @PutMapping("/{expense_id}")
    @RequiresPermission("create_expense")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("expense_id") Long expenseId,
                                                       @Valid @RequestBody ExpenseRequest request) {
        expenseService.update(expenseId, request);
        return ResponseEntity.ok(CommonResponse.success("Expense updated", null));
    }

    @DeleteMapping("/{expense_id}")
    @RequiresPermission("cancel_expenses")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("expense_id") Long expenseId) {
        expenseService.delete(expenseId);
        return ResponseEntity.ok(CommonResponse.success("Expense deleted", null));
    }

    @GetMapping("/{expense_id}")
    @RequiresPermission("view_expenses")
    public ResponseEntity<CommonResponse<ExpenseView>> get(@PathVariable("expense_id") Long expenseId) {
        return ResponseEntity.ok(CommonResponse.success(expenseService.get(expenseId)));
    }

    @GetMapping
    @RequiresPermission("view_expenses")
    public ResponseEntity<CommonResponse<PageResult<ExpenseView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(name = "fiscal_year_id", required = false) Long fiscalYearId,
            @RequestParam(name = "category_id", required = false) Long categoryId,
            @RequestParam(required = false) String status) {
        return ResponseEntity.ok(CommonResponse.success(
                expenseService.getAll(page, limit, fiscalYearId, categoryId, status)));
    }

    @PostMapping("/{expense_id}/review")
    @RequiresPermission("approve_expenses")
    public ResponseEntity<CommonResponse<Void>> review(@PathVariable("expense_id") Long expenseId,
                                                       @Valid @RequestBody ExpenseReviewRequest request) {
        expenseService.review(expenseId, request.getStatus(), request.getComments());
        return ResponseEntity.ok(CommonResponse.success("Expense " + request.getStatus(), null));
    }

    @GetMapping("/reports/{type}")
    @RequiresPermission("view_expenses")
    public ResponseEntity<CommonResponse<List<Map<String, Object>>>> getReport(
            @PathVariable("type") String type,
            @RequestParam(name = "fiscal_year_id", required = false) Long fiscalYearId,
            @RequestParam(required = false) Integer year) {
        return ResponseEntity.ok(CommonResponse.success(expenseService.getReport(type, fiscalYearId, year)));
    }
}
