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
public class GroupRequest {

    @NotBlank(message = "groupName is required")
    @Size(max = 100, message = "groupName must be at most 100 characters")
    private String groupName;

    @NotNull(message = "leaderId is required")
    private Long leaderId;

    @NotNull(message = "typeId is required")
    private Long typeId;

    @Size(max = 500, message = "description must be at most 500 characters")
    private String description;
}
