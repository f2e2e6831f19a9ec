package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Contribution Entity: 奉献/捐款记录，软删除，可恢复
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "contribution")
public class Contribution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "contribution_id")
    private Long contributionId;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    /**
     * contribution_date: 不能晚于当天
     */
    @Column(name = "contribution_date", nullable = false)
    private LocalDate contributionDate;

    @Column(name = "contribution_type_id", nullable = false)
    private Long contributionTypeId;

    @Column(name = "payment_option_id", nullable = false)
    private Long paymentOptionId;

    @Column(name = "mbr_id", nullable = false)
    private Long mbrId;

    @Column(name = "fiscal_year_id", nullable = false)
    private Long fiscalYearId;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "recorded_by")
    private Long recordedBy;

    @Column(name = "recorded_at")
    private LocalDateTime recordedAt;
}
