package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class GroupView {

    private Long groupId;
    private String groupName;
    private String groupDescription;
    private Long groupLeaderId;
    private String leaderName;
    private Long groupTypeId;
    private String typeName;
    private Long branchId;
    private String branchName;
    private Long memberCount;
    private LocalDateTime createdAt;
}
