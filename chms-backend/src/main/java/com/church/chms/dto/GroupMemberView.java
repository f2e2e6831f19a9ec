package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class GroupMemberView {

    private Long mbrId;
    private String firstName;
    private String familyName;
    private String emailAddress;
    private LocalDateTime joinedAt;
}
