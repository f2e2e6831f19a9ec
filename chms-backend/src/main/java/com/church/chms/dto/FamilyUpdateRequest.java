package com.church.chms.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FamilyUpdateRequest {

    @Size(max = 100, message = "familyName must be at most 100 characters")
    private String familyName;

    private Long branchId;
}
