package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class ContributionView {

    private Long contributionId;
    private BigDecimal amount;
    private LocalDate contributionDate;
    private Long contributionTypeId;
    private String typeName;
    private Long paymentOptionId;
    private String optionName;
    private Long mbrId;
    private String memberName;
    private Long fiscalYearId;
    private String description;
    private Long recordedBy;
    private LocalDateTime recordedAt;
}
