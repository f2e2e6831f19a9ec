package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Expense: 支出申请，审批通过 (Approved) 的支出才计入财务报表
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "expense")
public class Expense {

    public static final String STATUS_PENDING = "Pending Approval";
    public static final String STATUS_APPROVED = "Approved";
    public static final String STATUS_DECLINED = "Declined";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "expense_id")
    private Long expenseId;

    @Column(name = "expense_title", length = 100)
    private String expenseTitle;

    @Column(name = "expense_purpose", length = 500)
    private String expensePurpose;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "expense_date", nullable = false)
    private LocalDate expenseDate;

    @Column(name = "exp_category_id", nullable = false)
    private Long expCategoryId;

    @Column(name = "fiscal_year_id", nullable = false)
    private Long fiscalYearId;

    @Column(name = "branch_id")
    private Long branchId;

    // 申请人
    @Column(name = "mbr_id")
    private Long mbrId;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
