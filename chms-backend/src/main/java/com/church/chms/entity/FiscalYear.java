package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * FiscalYear: 财年，同一分堂的 Active 财年日期不能重叠
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "fiscalyear")
public class FiscalYear {

    public static final String STATUS_ACTIVE = "Active";
    public static final String STATUS_CLOSED = "Closed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "fiscal_year_id")
    private Long fiscalYearId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "branch_id", nullable = false)
    private Long branchId;

    @Column(name = "status", nullable = false, length = 10)
    private String status;
}
