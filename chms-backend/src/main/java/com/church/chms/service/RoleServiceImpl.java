package com.church.chms.service;

import com.church.chms.dto.RoleRequest;
import com.church.chms.entity.MemberRole;
import com.church.chms.entity.Role;
import com.church.chms.entity.RolePermission;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.MemberRoleRepository;
import com.church.chms.repository.PermissionRepository;
import com.church.chms.repository.RolePermissionRepository;
import com.church.chms.repository.RoleRepository;
import com.church.chms.security.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional(readOnly = true)
public class RoleServiceImpl implements RoleService {

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final MemberRoleRepository memberRoleRepository;
    private final ChurchMemberRepository memberRepository;
    private final CommunicationService communicationService;
    private final OrmTemplate orm;
    private final AuditLogService auditLogService;
    private final RequestContext requestContext;

    public RoleServiceImpl(RoleRepository roleRepository,
                           PermissionRepository permissionRepository,
                           RolePermissionRepository rolePermissionRepository,
                           MemberRoleRepository memberRoleRepository,
                           ChurchMemberRepository memberRepository,
                           CommunicationService communicationService,
                           OrmTemplate orm,
                           AuditLogService auditLogService,
                           RequestContext requestContext) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.memberRoleRepository = memberRoleRepository;
        this.memberRepository = memberRepository;
        this.communicationService = communicationService;
        this.orm = orm;
        this.auditLogService = auditLogService;
        this.requestContext = requestContext;
    }

    @Override
    @Transactional
    public Long create(RoleRequest request) {
        String name = request.getRoleName().trim();
        if (roleRepository.existsByRoleName(name)) {
            throw new BadRequestException("Role name already exists");
        }
        Long roleId = roleRepository.save(new Role(null, name, request.getDescription())).getRoleId();
        auditLogService.log("create", "role", roleId, Map.of("role_name", name), null);
        communicationService.notify("New Role Created", "Role '" + name + "' has been created.",
                currentMember(), null, null);
        return roleId;
    }

    @Override
    @Transactional
    public void update(Long roleId, RoleRequest request) {
        Role role = findRole(roleId);
        String name = request.getRoleName().trim();
        if (roleRepository.existsByRoleNameAndRoleIdNot(name, roleId)) {
            throw new BadRequestException("Role name already exists");
        }
        auditLogService.log("update", "role", roleId,
                Map.of("old_name", role.getRoleName(), "new_name", name), null);
        role.setRoleName(name);
        if (request.getDescription() != null) {
            role.setRoleDescription(request.getDescription());
        }
        roleRepository.save(role);
        communicationService.notify("Role Updated", "Role '" + name + "' has been updated.",
                currentMember(), null, null);
    }

    @Override
    @Transactional
    public void delete(Long roleId) {
        Role role = findRole(roleId);
        if (memberRoleRepository.existsByRoleId(roleId)) {
            throw new BadRequestException("Cannot delete role assigned to members");
        }
        if (rolePermissionRepository.existsByRoleId(roleId)) {
            throw new BadRequestException("Cannot delete role with assigned permissions");
        }
        roleRepository.delete(role);
        auditLogService.log("delete", "role", roleId, Map.of("role_name", role.getRoleName()), null);
        log.info("角色已删除: {}", role.getRoleName());
    }

    @Override
    public List<Role> getAll() {
        return roleRepository.findAll(Sort.by("roleName"));
    }

    @Override
    @Transactional
    public void assignPermission(Long roleId, Long permissionId) {
        requireRole(roleId);
        if (!permissionRepository.existsById(permissionId)) {
            throw new ResourceNotFoundException("Permission not found");
        }
        if (rolePermissionRepository.existsByRoleIdAndPermissionId(roleId, permissionId)) {
            throw new BadRequestException("Permission already assigned to role");
        }
        rolePermissionRepository.save(new RolePermission(null, roleId, permissionId));
        auditLogService.log("assign_permission", "role", roleId, Map.of("permission_id", permissionId), null);
    }

    @Override
    @Transactional
    public void removePermission(Long roleId, Long permissionId) {
        RolePermission link = rolePermissionRepository.findByRoleIdAndPermissionId(roleId, permissionId)
                .orElseThrow(() -> new ResourceNotFoundException("Permission is not assigned to role"));
        rolePermissionRepository.delete(link);
        auditLogService.log("remove_permission", "role", roleId, Map.of("permission_id", permissionId), null);
    }

    @Override
    @Transactional
    public void assignToMember(Long memberId, Long roleId) {
        if (memberRepository.findByMbrIdAndDeletedFalse(memberId).isEmpty()) {
            throw new ResourceNotFoundException("Member not found");
        }
        requireRole(roleId);
        MemberRole memberRole = memberRoleRepository.findByMbrId(memberId).orElseGet(MemberRole::new);
        memberRole.setMbrId(memberId);
        memberRole.setRoleId(roleId);
        memberRoleRepository.save(memberRole);
        auditLogService.logMember("assign_role", memberId, Map.of("role_id", roleId));
        log.info("成员角色已更新: mbrId={}, roleId={}", memberId, roleId);
    }

    @Override
    @Transactional
    public void removeFromMember(Long memberId) {
        if (memberRepository.findByMbrIdAndDeletedFalse(memberId).isEmpty()) {
            throw new BadRequestException("Invalid member");
        }
        MemberRole memberRole = memberRoleRepository.findByMbrId(memberId)
                .orElseThrow(() -> new BadRequestException("Member has no role assigned"));
        String roleName = roleRepository.findById(memberRole.getRoleId()).map(Role::getRoleName).orElse("");
        memberRoleRepository.delete(memberRole);
        auditLogService.logMember("remove_role", memberId, Map.of("role_id", memberRole.getRoleId()));
        communicationService.notify("Role Removed", "Your role '" + roleName + "' has been removed.",
                currentMember(), null, memberId);
    }

    @Override
    public List<String> getMemberPermissions(Long memberId) {
        QueryBuilder query = QueryBuilder.from("memberrole", "mr")
                .select("p.permission_name")
                .join("role_permission", "rp", "rp.role_id = mr.role_id")
                .join("permission", "p", "p.permission_id = rp.permission_id")
                .where("mr.mbr_id", memberId)
                .orderBy("p.permission_name");
        return orm.select(query).stream()
                .map(row -> (String) row.get("permission_name"))
                .collect(Collectors.toList());
    }

    private Role findRole(Long roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> new ResourceNotFoundException("Role not found"));
    }

    private Long currentMember() {
        return requestContext.currentMemberId().orElse(null);
    }

    private void requireRole(Long roleId) {
        if (!roleRepository.existsById(roleId)) {
            throw new ResourceNotFoundException("Role not found");
        }
    }
}
