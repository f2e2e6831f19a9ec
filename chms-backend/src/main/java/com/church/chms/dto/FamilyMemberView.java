package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class FamilyMemberView {

    private Long mbrId;
    private String firstName;
    private String familyName;
    private String gender;
    private LocalDate dateOfBirth;
    private String familyRole;
    private LocalDateTime joinedAt;
}
