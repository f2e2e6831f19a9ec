package com.church.chms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 注册请求：资料 + 登录凭据
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true, exclude = "password")
public class MemberRegistrationRequest extends MemberUpdateRequest {

    @NotBlank(message = "username is required")
    @Size(min = 3, max = 50, message = "username must be 3 to 50 characters")
    private String username;

    @NotBlank(message = "password is required")
    @Size(min = 8, message = "password must be at least 8 characters")
    private String password;
}
