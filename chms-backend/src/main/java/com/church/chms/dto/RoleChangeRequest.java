package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 家庭角色变更
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoleChangeRequest {

    @NotBlank(message = "role is required")
    private String role;
}
