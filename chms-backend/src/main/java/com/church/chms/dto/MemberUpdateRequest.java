package com.church.chms.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * 成员资料；phones 不为 null 时整体替换成员的电话列表
 */
@Data
public class MemberUpdateRequest {

    @NotBlank(message = "firstName is required")
    @Size(max = 50, message = "firstName must be at most 50 characters")
    private String firstName;

    @NotBlank(message = "familyName is required")
    @Size(max = 50, message = "familyName must be at most 50 characters")
    private String familyName;

    @Size(max = 100, message = "otherNames must be at most 100 characters")
    private String otherNames;

    @Pattern(regexp = "Male|Female", message = "gender must be Male or Female")
    private String gender;

    @NotBlank(message = "emailAddress is required")
    @Email(message = "emailAddress must be a valid email")
    private String emailAddress;

    @Size(max = 255, message = "residentialAddress must be at most 255 characters")
    private String residentialAddress;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate dateOfBirth;

    @Size(max = 100, message = "occupation must be at most 100 characters")
    private String occupation;

    private Long branchId;

    @Valid
    private List<PhoneRequest> phones;
}
