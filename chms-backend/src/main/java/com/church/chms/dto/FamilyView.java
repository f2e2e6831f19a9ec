package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
public class FamilyView {

    private Long familyId;
    private String familyName;
    private Long headOfHouseholdId;
    private String headName;
    private Long branchId;
    private String branchName;
    private LocalDateTime createdAt;
    private Long memberCount;
    private List<FamilyMemberView> members;
}
