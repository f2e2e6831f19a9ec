package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BudgetReviewRequest {

    @NotBlank(message = "action is required")
    @Pattern(regexp = "approve|reject", message = "action must be approve or reject")
    private String action;

    @Size(max = 500, message = "remarks must be at most 500 characters")
    private String remarks;
}
