package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.ExpenseCategoryRequest;
import com.church.chms.entity.ExpenseCategory;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.ExpenseCategoryService;
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
@RequestMapping("/api/expense-categories")
public class ExpenseCategoryController {

    private final ExpenseCategoryService categoryService;

    public ExpenseCategoryController(ExpenseCategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @PostMapping
    @RequiresPermission("manage_expense_categories")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody ExpenseCategoryRequest request) {
        Long categoryId = categoryService.create(request.getCategoryName());
        return ResponseEntity.ok(CommonResponse.success("Expense category created", new CreatedId(categoryId)));
    }

    @PutMapping("/{category_id}")
    @RequiresPermission("manage_expense_categories")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("category_id") Long categoryId,
                                                       @Valid @RequestBody ExpenseCategoryRequest request) {
        categoryService.update(categoryId, request.getCategoryName());
        return ResponseEntity.ok(CommonResponse.success("Expense category updated", null));
    }

    @DeleteMapping("/{category_id}")
    @RequiresPermission("manage_expense_categories")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("category_id") Long categoryId) {
        categoryService.delete(categoryId);
        return ResponseEntity.ok(CommonResponse.success("Expense category deleted", null));
    }

    @GetMapping("/{category_id}")
    @RequiresPermission("view_expense")
    public ResponseEntity<CommonResponse<ExpenseCategory>> get(@PathVariable("category_id") Long categoryId) {
        return ResponseEntity.ok(CommonResponse.success(categoryService.get(categoryId)));
    }

    @GetMapping
    @RequiresPermission("view_expense")
    public ResponseEntity<CommonResponse<PageResult<ExpenseCategory>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) String name) {
        return ResponseEntity.ok(CommonResponse.success(categoryService.getAll(page, limit, name)));
    }
}
