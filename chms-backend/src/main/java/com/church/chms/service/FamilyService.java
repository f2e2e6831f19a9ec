package com.church.chms.service;

import com.church.chms.dto.FamilyCreateRequest;
import com.church.chms.dto.FamilyUpdateRequest;
import com.church.chms.dto.FamilyView;
import com.church.chms.orm.PageResult;

public interface FamilyService {

    Long create(FamilyCreateRequest request);

    void update(Long familyId, FamilyUpdateRequest request);

    void delete(Long familyId);

    FamilyView get(Long familyId);

    PageResult<FamilyView> getAll(int page, int limit, Long branchId, String name);

    void addMember(Long familyId, Long memberId, String role);

    void removeMember(Long familyId, Long memberId);

    void updateMemberRole(Long familyId, Long memberId, String role);
}
