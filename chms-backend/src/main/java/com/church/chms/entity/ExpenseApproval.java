package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * ExpenseApproval: 支出审批记录，每次审批一行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "expense_approval")
public class ExpenseApproval {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "approval_id")
    private Long approvalId;

    @Column(name = "expense_id", nullable = false)
    private Long expenseId;

    @Column(name = "approver_id")
    private Long approverId;

    // Approved / Declined
    @Column(name = "approval_status", nullable = false, length = 20)
    private String approvalStatus;

    @Column(name = "approval_date", nullable = false)
    private LocalDateTime approvalDate;

    @Column(name = "comments", length = 500)
    private String comments;
}
