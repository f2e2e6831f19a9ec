package com.church.chms.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VolunteerAssignmentResult {

    private int assigned;

    // 已在该活动中、被跳过的成员
    private List<Long> skippedMemberIds;
}
