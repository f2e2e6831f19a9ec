package com.church.chms.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 收支表：收入按奉献类型、支出按支出类别汇总
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IncomeStatement {

    private Long fiscalYearId;
    private List<Line> income;
    private List<Line> expenses;
    private BigDecimal totalIncome;
    private BigDecimal totalExpenses;
    private BigDecimal netIncome;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {
        private Long id;
        private String name;
        private BigDecimal total;
    }
}
