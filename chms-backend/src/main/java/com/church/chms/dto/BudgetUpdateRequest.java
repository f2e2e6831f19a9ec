package com.church.chms.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BudgetUpdateRequest {

    @NotNull(message = "amount is required")
    private BigDecimal amount;

    // 审批结果只能通过 review 写入
    @Pattern(regexp = "Draft|Submitted", message = "status must be Draft or Submitted")
    private String status;
}
