package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class BudgetView {

    private Long budgetId;
    private Long fiscalYearId;
    private LocalDate fiscalYearStart;
    private LocalDate fiscalYearEnd;
    private Long expCategoryId;
    private String categoryName;
    private Long branchId;
    private String branchName;
    private BigDecimal budgetAmount;
    private String status;
    private String remarks;
    private LocalDateTime createdAt;
    private LocalDateTime reviewedAt;
}
