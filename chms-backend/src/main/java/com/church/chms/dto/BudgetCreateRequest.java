package com.church.chms.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BudgetCreateRequest {

    @NotNull(message = "fiscalYearId is required")
    private Long fiscalYearId;

    @NotNull(message = "categoryId is required")
    private Long categoryId;

    @NotNull(message = "branchId is required")
    private Long branchId;

    @NotNull(message = "amount is required")
    private BigDecimal amount;

    @Size(max = 500, message = "remarks must be at most 500 characters")
    private String remarks;
}
