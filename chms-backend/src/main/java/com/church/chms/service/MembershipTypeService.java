package com.church.chms.service;

import com.church.chms.dto.AssignmentFilter;
import com.church.chms.dto.MembershipAssignmentRequest;
import com.church.chms.dto.MembershipAssignmentView;
import com.church.chms.dto.MembershipTypeRequest;
import com.church.chms.entity.MembershipType;
import com.church.chms.orm.PageResult;

import java.time.LocalDate;
import java.util.List;

public interface MembershipTypeService {

    Long createType(MembershipTypeRequest request);

    void updateType(Long typeId, MembershipTypeRequest request);

    void deleteType(Long typeId);

    MembershipType getType(Long typeId);

    PageResult<MembershipType> getAllTypes(int page, int limit, String name);

    /**
     * 为成员分配会籍类型：成员不能有未结束的分配，新分配不能与已有分配重叠
     */
    Long assignType(Long memberId, MembershipAssignmentRequest request);

    void updateAssignment(Long assignmentId, LocalDate endDate);

    List<MembershipAssignmentView> getMemberAssignments(Long memberId, AssignmentFilter filter);
}
