package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FamilyCreateRequest {

    @NotBlank(message = "familyName is required")
    @Size(max = 100, message = "familyName must be at most 100 characters")
    private String familyName;

    @NotNull(message = "headOfHouseholdId is required")
    private Long headOfHouseholdId;

    @NotNull(message = "branchId is required")
    private Long branchId;
}
