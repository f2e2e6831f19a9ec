package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
public class MembershipAssignmentView {

    private Long assignmentId;
    private Long mbrId;
    private Long membershipTypeId;
    private String typeName;
    private LocalDate startDate;
    private LocalDate endDate;
}
