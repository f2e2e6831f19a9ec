package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Budget Entity: 预算
 * 状态流转 Draft → Submitted → Approved / Rejected，Rejected 可再次提交；Approved 后锁定。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "budget")
public class Budget {

    public static final String STATUS_DRAFT = "Draft";
    public static final String STATUS_SUBMITTED = "Submitted";
    public static final String STATUS_APPROVED = "Approved";
    public static final String STATUS_REJECTED = "Rejected";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "budget_id")
    private Long budgetId;

    @Column(name = "fiscal_year_id", nullable = false)
    private Long fiscalYearId;

    @Column(name = "exp_category_id", nullable = false)
    private Long expCategoryId;

    @Column(name = "branch_id", nullable = false)
    private Long branchId;

    /**
     * budget_amount: 必须大于 0
     */
    @Column(name = "budget_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal budgetAmount;

    @Column(name = "status", nullable = false, length = 10)
    private String status;

    @Column(name = "remarks", length = 500)
    private String remarks;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;
}
