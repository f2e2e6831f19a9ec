package com.church.chms.dto;

import com.church.chms.entity.ExpenseApproval;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
public class ExpenseView {

    private Long expenseId;
    private String expenseTitle;
    private String expensePurpose;
    private BigDecimal amount;
    private LocalDate expenseDate;
    private Long expCategoryId;
    private String categoryName;
    private Long fiscalYearId;
    private Long branchId;
    private String branchName;
    private Long mbrId;
    private String requesterName;
    private String status;
    private LocalDateTime createdAt;
    // 只在查询单条时填充
    private List<ExpenseApproval> approvals;
}
