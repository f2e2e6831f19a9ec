package com.church.chms.service;

import com.church.chms.dto.VolunteerAssignmentRequest;
import com.church.chms.dto.VolunteerAssignmentResult;
import com.church.chms.dto.VolunteerRoleRequest;
import com.church.chms.dto.VolunteerView;
import com.church.chms.entity.VolunteerRole;
import com.church.chms.orm.PageResult;

import java.util.List;

public interface VolunteerService {

    List<VolunteerRole> getRoles();

    Long createRole(VolunteerRoleRequest request);

    /**
     * 批量分配志愿者；任一成员或角色无效时整批回滚，已分配的成员跳过
     */
    VolunteerAssignmentResult assign(Long eventId, VolunteerAssignmentRequest request);

    /**
     * 被分配的成员本人确认或拒绝
     *
     * @param action confirm / decline
     */
    void confirmAssignment(Long assignmentId, String action);

    void completeAssignment(Long assignmentId);

    void remove(Long assignmentId);

    PageResult<VolunteerView> getByEvent(Long eventId, int page, int limit);
}
