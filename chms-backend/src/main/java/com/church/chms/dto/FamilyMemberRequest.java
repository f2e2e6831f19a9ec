package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FamilyMemberRequest {

    @NotNull(message = "memberId is required")
    private Long memberId;

    @NotBlank(message = "role is required")
    private String role;
}
