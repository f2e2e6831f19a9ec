package com.church.chms.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContributionRequest {

    @NotNull(message = "amount is required")
    private BigDecimal amount;

    @NotNull(message = "contributionDate is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate contributionDate;

    @NotNull(message = "contributionTypeId is required")
    private Long contributionTypeId;

    @NotNull(message = "paymentOptionId is required")
    private Long paymentOptionId;

    @NotNull(message = "memberId is required")
    private Long memberId;

    @NotNull(message = "fiscalYearId is required")
    private Long fiscalYearId;

    @Size(max = 500, message = "description must be at most 500 characters")
    private String description;
}
