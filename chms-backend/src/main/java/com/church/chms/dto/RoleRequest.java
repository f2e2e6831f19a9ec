package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoleRequest {

    @NotBlank(message = "roleName is required")
    @Size(max = 50, message = "roleName must be at most 50 characters")
    private String roleName;

    @Size(max = 255, message = "description must be at most 255 characters")
    private String description;
}
