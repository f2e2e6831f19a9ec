package com.church.chms.service;

import com.church.chms.dto.RoleRequest;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.MemberRole;
import com.church.chms.entity.Role;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.MemberRoleRepository;
import com.church.chms.repository.PermissionRepository;
import com.church.chms.repository.RolePermissionRepository;
import com.church.chms.repository.RoleRepository;
import com.church.chms.security.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class RoleServiceImplTest {

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    @Mock
    private MemberRoleRepository memberRoleRepository;

    @Mock
    private ChurchMemberRepository memberRepository;

    @Mock
    private CommunicationService communicationService;

    @Mock
    private OrmTemplate orm;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private RequestContext requestContext;

    private RoleServiceImpl roleService;

    @BeforeEach
    void setUp() {
        roleService = new RoleServiceImpl(roleRepository, permissionRepository, rolePermissionRepository,
                memberRoleRepository, memberRepository, communicationService, orm, auditLogService, requestContext);
    }

    @Test
    void testCreate_DuplicateName() {
        when(roleRepository.existsByRoleName("Usher Lead")).thenReturn(true);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> roleService.create(new RoleRequest("Usher Lead", null)));
        assertEquals("Role name already exists", ex.getMessage());
        verifyNoInteractions(communicationService);
    }

    @Test
    void testCreate_Success() {
        when(roleRepository.existsByRoleName("Usher Lead")).thenReturn(false);
        when(roleRepository.save(any(Role.class))).thenReturn(new Role(7L, "Usher Lead", "Leads ushers"));
        when(requestContext.currentMemberId()).thenReturn(Optional.of(1L));

        assertEquals(7L, roleService.create(new RoleRequest("Usher Lead", "Leads ushers")));
        verify(communicationService).notify("New Role Created", "Role 'Usher Lead' has been created.", 1L, null, null);
    }

    @Test
    void testUpdate_KeepsDescriptionWhenAbsent() {
        Role role = new Role(5L, "Group Leader", "Leads ministry groups");
        when(roleRepository.findById(5L)).thenReturn(Optional.of(role));
        when(roleRepository.existsByRoleNameAndRoleIdNot("Ministry Leader", 5L)).thenReturn(false);
        when(requestContext.currentMemberId()).thenReturn(Optional.empty());

        roleService.update(5L, new RoleRequest("Ministry Leader", null));

        assertEquals("Ministry Leader", role.getRoleName());
        assertEquals("Leads ministry groups", role.getRoleDescription());
        verify(communicationService).notify(eq("Role Updated"), anyString(), isNull(), isNull(), isNull());
    }

    @Test
    void testDelete_AssignedToMembers() {
        when(roleRepository.findById(5L)).thenReturn(Optional.of(new Role(5L, "Group Leader", null)));
        when(memberRoleRepository.existsByRoleId(5L)).thenReturn(true);

        BadRequestException ex = assertThrows(BadRequestException.class, () -> roleService.delete(5L));
        assertEquals("Cannot delete role assigned to members", ex.getMessage());
    }

    @Test
    void testDelete_HasPermissions() {
        when(roleRepository.findById(5L)).thenReturn(Optional.of(new Role(5L, "Group Leader", null)));
        when(memberRoleRepository.existsByRoleId(5L)).thenReturn(false);
        when(rolePermissionRepository.existsByRoleId(5L)).thenReturn(true);

        BadRequestException ex = assertThrows(BadRequestException.class, () -> roleService.delete(5L));
        assertEquals("Cannot delete role with assigned permissions", ex.getMessage());
        verify(roleRepository, never()).delete(any());
    }

    @Test
    void testDelete_NotFound() {
        when(roleRepository.findById(50L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class, () -> roleService.delete(50L));
        assertEquals("Role not found", ex.getMessage());
    }

    @Test
    void testRemoveFromMember_NoRole() {
        when(memberRepository.findByMbrIdAndDeletedFalse(3L)).thenReturn(Optional.of(new ChurchMember()));
        when(memberRoleRepository.findByMbrId(3L)).thenReturn(Optional.empty());

        BadRequestException ex = assertThrows(BadRequestException.class, () -> roleService.removeFromMember(3L));
        assertEquals("Member has no role assigned", ex.getMessage());
    }

    @Test
    void testRemoveFromMember_NotifiesMember() {
        MemberRole memberRole = new MemberRole(2L, 3L, 5L);
        when(memberRepository.findByMbrIdAndDeletedFalse(3L)).thenReturn(Optional.of(new ChurchMember()));
        when(memberRoleRepository.findByMbrId(3L)).thenReturn(Optional.of(memberRole));
        when(roleRepository.findById(5L)).thenReturn(Optional.of(new Role(5L, "Group Leader", null)));
        when(requestContext.currentMemberId()).thenReturn(Optional.of(1L));

        roleService.removeFromMember(3L);

        verify(memberRoleRepository).delete(memberRole);
        verify(communicationService).notify("Role Removed", "Your role 'Group Leader' has been removed.", 1L, null, 3L);
    }

    @Test
    void testRemoveFromMember_InvalidMember() {
        when(memberRepository.findByMbrIdAndDeletedFalse(3L)).thenReturn(Optional.empty());

        BadRequestException ex = assertThrows(BadRequestException.class, () -> roleService.removeFromMember(3L));
        assertEquals("Invalid member", ex.getMessage());
        verifyNoInteractions(memberRoleRepository);
    }
}
