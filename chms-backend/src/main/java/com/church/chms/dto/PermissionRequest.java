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
public class PermissionRequest {

    @NotBlank(message = "permissionName is required")
    @Size(max = 100, message = "permissionName must be at most 100 characters")
    @Pattern(regexp = "[A-Za-z0-9_]+", message = "permissionName may contain only letters, digits and underscores")
    private String permissionName;
}
