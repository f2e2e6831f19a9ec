package com.church.chms.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BudgetVsActual {

    private Long fiscalYearId;
    private List<Line> lines;
    private BigDecimal totalBudget;
    private BigDecimal totalActual;
    private BigDecimal totalVariance;

    /**
     * variance = budgetAmount - actualAmount，负数表示超支
     */
    @Data
    @NoArgsConstructor
    public static class Line {
        private Long expCategoryId;
        private String categoryName;
        private BigDecimal budgetAmount;
        private BigDecimal actualAmount;
        private Long expenseCount;
        private BigDecimal variance;
    }
}
