package com.church.chms.service;

import com.church.chms.config.ChmsProperties;
import com.church.chms.dto.MemberRegistrationRequest;
import com.church.chms.dto.MemberUpdateRequest;
import com.church.chms.dto.MemberView;
import com.church.chms.dto.PhoneRequest;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.MemberPhone;
import com.church.chms.entity.MemberRole;
import com.church.chms.entity.UserAuthentication;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.MemberPhoneRepository;
import com.church.chms.repository.MemberRoleRepository;
import com.church.chms.repository.UserAuthenticationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class MemberServiceImplTest {

    @Mock
    private ChurchMemberRepository memberRepository;

    @Mock
    private MemberPhoneRepository phoneRepository;

    @Mock
    private UserAuthenticationRepository authRepository;

    @Mock
    private MemberRoleRepository memberRoleRepository;

    @Mock
    private OrmTemplate orm;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private AuditLogService auditLogService;

    private MemberServiceImpl memberService;

    private ChurchMember activeMember;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        memberService = new MemberServiceImpl(memberRepository, phoneRepository, authRepository,
                memberRoleRepository, orm, passwordEncoder, auditLogService, new ChmsProperties(), clock);

        activeMember = new ChurchMember();
        activeMember.setMbrId(1L);
        activeMember.setFirstName("Kwame");
        activeMember.setFamilyName("Mensah");
        activeMember.setEmailAddress("kwame@example.com");
        activeMember.setMembershipStatus(ChurchMember.STATUS_ACTIVE);
        activeMember.setBranchId(1L);
    }

    private MemberRegistrationRequest registration() {
        MemberRegistrationRequest request = new MemberRegistrationRequest();
        request.setFirstName("Ama");
        request.setFamilyName("Owusu");
        request.setEmailAddress("ama@example.com");
        request.setUsername("ama.owusu");
        request.setPassword("s3cretpass");
        return request;
    }

    // 注册：默认值、密码哈希、默认角色
    @Test
    void testRegister_Success() {
        MemberRegistrationRequest request = registration();
        request.setPhones(List.of(new PhoneRequest("0241234567", "Mobile", null)));

        when(authRepository.existsByUsername("ama.owusu")).thenReturn(false);
        when(phoneRepository.existsByPhoneNumber("0241234567")).thenReturn(false);
        when(memberRepository.save(any(ChurchMember.class))).thenAnswer(invocation -> {
            ChurchMember saved = invocation.getArgument(0);
            saved.setMbrId(10L);
            return saved;
        });
        when(passwordEncoder.encode("s3cretpass")).thenReturn("$2a$hash");

        Long memberId = memberService.register(request);

        assertEquals(10L, memberId);

        ArgumentCaptor<ChurchMember> memberCaptor = ArgumentCaptor.forClass(ChurchMember.class);
        verify(memberRepository).save(memberCaptor.capture());
        ChurchMember saved = memberCaptor.getValue();
        assertEquals("Male", saved.getGender());
        assertEquals("Not Applicable", saved.getOccupation());
        assertEquals(1L, saved.getBranchId());
        assertEquals(ChurchMember.STATUS_ACTIVE, saved.getMembershipStatus());
        assertEquals(LocalDate.of(2025, 3, 1), saved.getRegistrationDate());
        assertFalse(saved.isDeleted());

        ArgumentCaptor<MemberPhone> phoneCaptor = ArgumentCaptor.forClass(MemberPhone.class);
        verify(phoneRepository).save(phoneCaptor.capture());
        assertTrue(phoneCaptor.getValue().isPrimaryPhone());

        ArgumentCaptor<UserAuthentication> authCaptor = ArgumentCaptor.forClass(UserAuthentication.class);
        verify(authRepository).save(authCaptor.capture());
        assertEquals("$2a$hash", authCaptor.getValue().getPasswordHash());

        ArgumentCaptor<MemberRole> roleCaptor = ArgumentCaptor.forClass(MemberRole.class);
        verify(memberRoleRepository).save(roleCaptor.capture());
        assertEquals(6L, roleCaptor.getValue().getRoleId());

        verify(auditLogService).logMember(eq("create"), eq(10L), anyMap());
    }

    @Test
    void testRegister_DuplicateUsername() {
        when(authRepository.existsByUsername("ama.owusu")).thenReturn(true);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> memberService.register(registration()));

        assertEquals("Username already exists", ex.getMessage());
        verify(memberRepository, never()).save(any());
    }

    // 同一请求中重复的号码
    @Test
    void testRegister_DuplicatePhoneInRequest() {
        MemberRegistrationRequest request = registration();
        request.setPhones(List.of(
                new PhoneRequest("0241234567", "Mobile", true),
                new PhoneRequest("0241234567", "Home", false)));
        when(authRepository.existsByUsername("ama.owusu")).thenReturn(false);
        when(phoneRepository.existsByPhoneNumber("0241234567")).thenReturn(false);

        BadRequestException ex = assertThrows(BadRequestException.class, () -> memberService.register(request));

        assertEquals("Phone number already exists", ex.getMessage());
        verify(memberRepository, never()).save(any());
    }

    @Test
    void testUpdate_MemberNotFound() {
        when(memberRepository.findByMbrIdAndDeletedFalse(99L)).thenReturn(Optional.empty());

        MemberUpdateRequest request = new MemberUpdateRequest();
        request.setFirstName("Ama");
        request.setFamilyName("Owusu");
        request.setEmailAddress("ama@example.com");

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> memberService.update(99L, request));
        assertEquals("Member not found", ex.getMessage());
    }

    @Test
    void testDelete_SoftDeletes() {
        when(memberRepository.findByMbrIdAndDeletedFalse(1L)).thenReturn(Optional.of(activeMember));

        memberService.delete(1L);

        assertTrue(activeMember.isDeleted());
        verify(memberRepository).save(activeMember);
        verify(memberRepository, never()).delete(any());
    }

    @Test
    void testGet_NotFound() {
        when(orm.selectOne(any(QueryBuilder.class), eq(MemberView.class))).thenReturn(null);

        assertThrows(ResourceNotFoundException.class, () -> memberService.get(5L));
    }

    // 第一个号码自动成为主号码
    @Test
    void testAddPhone_FirstPhoneBecomesPrimary() {
        when(memberRepository.findByMbrIdAndDeletedFalse(1L)).thenReturn(Optional.of(activeMember));
        when(phoneRepository.existsByPhoneNumber("0201112222")).thenReturn(false);
        when(phoneRepository.countByMbrId(1L)).thenReturn(0L);
        when(phoneRepository.save(any(MemberPhone.class))).thenAnswer(invocation -> {
            MemberPhone phone = invocation.getArgument(0);
            phone.setMemberPhoneId(3L);
            return phone;
        });

        Long phoneId = memberService.addPhone(1L, new PhoneRequest("0201112222", "Work", false));

        assertEquals(3L, phoneId);
        verify(phoneRepository).clearPrimary(1L);
        ArgumentCaptor<MemberPhone> captor = ArgumentCaptor.forClass(MemberPhone.class);
        verify(phoneRepository).save(captor.capture());
        assertTrue(captor.getValue().isPrimaryPhone());
        assertEquals("Work", captor.getValue().getPhoneType());
    }

    @Test
    void testAddPhone_InactiveMember() {
        activeMember.setMembershipStatus(ChurchMember.STATUS_INACTIVE);
        when(memberRepository.findByMbrIdAndDeletedFalse(1L)).thenReturn(Optional.of(activeMember));

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> memberService.addPhone(1L, new PhoneRequest("0201112222", "Mobile", null)));
        assertEquals("Invalid member", ex.getMessage());
    }

    @Test
    void testAddPhone_DuplicateNumber() {
        when(memberRepository.findByMbrIdAndDeletedFalse(1L)).thenReturn(Optional.of(activeMember));
        when(phoneRepository.existsByPhoneNumber("0201112222")).thenReturn(true);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> memberService.addPhone(1L, new PhoneRequest("0201112222", "Mobile", null)));
        assertEquals("Phone number already exists", ex.getMessage());
        verify(phoneRepository, never()).save(any());
    }

    @Test
    void testDeletePhone_PrimaryRejected() {
        MemberPhone primary = new MemberPhone(4L, 1L, "0241234567", "Mobile", true);
        when(phoneRepository.findById(4L)).thenReturn(Optional.of(primary));

        BadRequestException ex = assertThrows(BadRequestException.class, () -> memberService.deletePhone(4L));
        assertEquals("Cannot delete primary phone number", ex.getMessage());
        verify(phoneRepository, never()).delete(any());
    }

    // 设为主号码时清除其他主号码
    @Test
    void testUpdatePhone_MakePrimaryClearsOthers() {
        MemberPhone secondary = new MemberPhone(5L, 1L, "0241234567", "Home", false);
        when(phoneRepository.findById(5L)).thenReturn(Optional.of(secondary));
        when(phoneRepository.existsByPhoneNumberAndMemberPhoneIdNot("0241234567", 5L)).thenReturn(false);

        memberService.updatePhone(5L, new PhoneRequest("0241234567", null, true));

        verify(phoneRepository).clearPrimary(1L);
        assertTrue(secondary.isPrimaryPhone());
        assertEquals("Home", secondary.getPhoneType());
    }
}
