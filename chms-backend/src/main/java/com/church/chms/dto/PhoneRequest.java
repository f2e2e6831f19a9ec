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
public class PhoneRequest {

    @NotBlank(message = "phoneNumber is required")
    @Size(max = 20, message = "phoneNumber must be at most 20 characters")
    private String phoneNumber;

    @Pattern(regexp = "Mobile|Home|Work|Other", message = "phoneType must be one of Mobile, Home, Work, Other")
    private String phoneType;

    // 为空时：成员的第一个号码自动成为主号码
    private Boolean primary;
}
