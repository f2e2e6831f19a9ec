package com.church.chms.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
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
public class ExpenseRequest {

    @NotBlank(message = "title is required")
    @Size(max = 100, message = "title must be at most 100 characters")
    private String title;

    @Size(max = 500, message = "purpose must be at most 500 characters")
    private String purpose;

    @NotNull(message = "amount is required")
    private BigDecimal amount;

    @NotNull(message = "expenseDate is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate expenseDate;

    @NotNull(message = "categoryId is required")
    private Long categoryId;

    @NotNull(message = "fiscalYearId is required")
    private Long fiscalYearId;

    private Long branchId;

    // 为空时取当前登录成员
    private Long memberId;
}
