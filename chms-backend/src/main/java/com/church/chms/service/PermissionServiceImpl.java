package com.church.chms.service;

import com.church.chms.dto.PermissionView;
import com.church.chms.entity.Permission;
import com.church.chms.entity.Role;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.PermissionRepository;
import com.church.chms.repository.RolePermissionRepository;
import com.church.chms.security.RequestContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class PermissionServiceImpl implements PermissionService {

    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final CommunicationService communicationService;
    private final OrmTemplate orm;
    private final RequestContext requestContext;

    public PermissionServiceImpl(PermissionRepository permissionRepository,
                                 RolePermissionRepository rolePermissionRepository,
                                 CommunicationService communicationService,
                                 OrmTemplate orm,
                                 RequestContext requestContext) {
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.communicationService = communicationService;
        this.orm = orm;
        this.requestContext = requestContext;
    }

    @Override
    @Transactional
    public Long create(String permissionName) {
        if (permissionRepository.existsByPermissionName(permissionName)) {
            throw new BadRequestException("Permission name already exists");
        }
        Long id = permissionRepository.save(new Permission(null, permissionName)).getPermissionId();
        communicationService.notify("Permission Created",
                "Permission '" + permissionName + "' has been created.", currentMember(), null, null);
        return id;
    }

    @Override
    @Transactional
    public void update(Long permissionId, String permissionName) {
        Permission permission = findPermission(permissionId);
        if (permissionRepository.existsByPermissionNameAndPermissionIdNot(permissionName, permissionId)) {
            throw new BadRequestException("Permission name already exists");
        }
        permission.setPermissionName(permissionName);
        permissionRepository.save(permission);
        communicationService.notify("Permission Updated",
                "Permission '" + permissionName + "' has been updated.", currentMember(), null, null);
    }

    @Override
    @Transactional
    public void delete(Long permissionId) {
        Permission permission = findPermission(permissionId);
        if (rolePermissionRepository.existsByPermissionId(permissionId)) {
            throw new BadRequestException("Cannot delete permission assigned to roles");
        }
        permissionRepository.delete(permission);
        communicationService.notify("Permission Deleted",
                "Permission '" + permission.getPermissionName() + "' has been deleted.", currentMember(), null, null);
    }

    @Override
    public PermissionView get(Long permissionId) {
        Permission permission = findPermission(permissionId);
        PermissionView view = new PermissionView();
        view.setPermissionId(permission.getPermissionId());
        view.setPermissionName(permission.getPermissionName());
        view.setRoles(rolesOf(permissionId));
        return view;
    }

    @Override
    public PageResult<PermissionView> getAll(int page, int limit, String name) {
        QueryBuilder query = QueryBuilder.from("permission", "p")
                .select("p.permission_id", "p.permission_name")
                .whereIfPresent("p.permission_name", "LIKE", name == null ? null : "%" + name.trim() + "%")
                .orderBy("p.permission_name");
        PageResult<PermissionView> result = orm.paginate(query, page, limit, PermissionView.class);
        result.getData().forEach(view -> view.setRoles(rolesOf(view.getPermissionId())));
        return result;
    }

    private List<Role> rolesOf(Long permissionId) {
        QueryBuilder query = QueryBuilder.from("role_permission", "rp")
                .select("r.role_id", "r.role_name", "r.role_description")
                .join("role", "r", "r.role_id = rp.role_id")
                .where("rp.permission_id", permissionId)
                .orderBy("r.role_name");
        return orm.select(query, Role.class);
    }

    private Permission findPermission(Long permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> new ResourceNotFoundException("Permission not found"));
    }

    private Long currentMember() {
        return requestContext.currentMemberId().orElse(null);
    }
}
