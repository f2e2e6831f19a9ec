package com.church.chms.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "Username and password required")
    @JsonAlias("userid")
    private String username;

    @NotBlank(message = "Username and password required")
    @JsonAlias("passkey")
    @ToString.Exclude
    private String password;
}
