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
public class MembershipTypeRequest {

    @NotBlank(message = "typeName is required")
    @Size(max = 100, message = "typeName must be at most 100 characters")
    @Pattern(regexp = "[A-Za-z0-9_]+", message = "typeName may contain only letters, digits and underscores")
    private String typeName;

    @Size(max = 500, message = "description must be at most 500 characters")
    private String description;
}
