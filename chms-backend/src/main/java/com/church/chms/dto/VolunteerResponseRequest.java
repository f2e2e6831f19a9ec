package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VolunteerResponseRequest {

    @NotBlank(message = "action is required")
    @Pattern(regexp = "confirm|decline", message = "action must be confirm or decline")
    private String action;
}
