package com.church.chms.service;

import com.church.chms.dto.PermissionView;
import com.church.chms.orm.PageResult;

public interface PermissionService {

    Long create(String permissionName);

    void update(Long permissionId, String permissionName);

    void delete(Long permissionId);

    PermissionView get(Long permissionId);

    PageResult<PermissionView> getAll(int page, int limit, String name);
}
