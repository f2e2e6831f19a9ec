package com.church.chms.service;

import com.church.chms.dto.RoleRequest;
import com.church.chms.entity.Role;

import java.util.List;

/**
 * 角色与权限的关联、成员角色分配
 */
public interface RoleService {

    Long create(RoleRequest request);

    void update(Long roleId, RoleRequest request);

    /**
     * 仍分配给成员或仍关联权限的角色不能删除
     */
    void delete(Long roleId);

    List<Role> getAll();

    void assignPermission(Long roleId, Long permissionId);

    void removePermission(Long roleId, Long permissionId);

    /**
     * 设置成员角色，已有角色时替换
     */
    void assignToMember(Long memberId, Long roleId);

    void removeFromMember(Long memberId);

    List<String> getMemberPermissions(Long memberId);
}
