package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class VolunteerView {

    private Long eventVolunteerId;
    private Long eventId;
    private Long mbrId;
    private String memberName;
    private Long volunteerRoleId;
    private String roleName;
    private String status;
    private String notes;
    private Long assignedBy;
    private LocalDateTime assignedAt;
    private LocalDateTime respondedAt;
}
