package com.church.chms.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 部分更新：只修改非空字段
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContributionUpdateRequest {

    private BigDecimal amount;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate contributionDate;

    private Long contributionTypeId;

    private Long paymentOptionId;

    @Size(max = 500, message = "description must be at most 500 characters")
    private String description;
}
