package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GroupTypeRequest {

    @NotBlank(message = "typeName is required")
    @Size(max = 50, message = "typeName must be at most 50 characters")
    private String typeName;
}
