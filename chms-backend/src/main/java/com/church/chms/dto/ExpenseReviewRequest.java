package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseReviewRequest {

    // Approved / Declined
    @NotBlank(message = "status is required")
    private String status;

    @Size(max = 500, message = "comments must be at most 500 characters")
    private String comments;
}
