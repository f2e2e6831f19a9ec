package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
public class FiscalYearView {

    private Long fiscalYearId;
    private LocalDate startDate;
    private LocalDate endDate;
    private Long branchId;
    private String branchName;
    private String status;
}
