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
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.MemberPhoneRepository;
import com.church.chms.repository.MemberRoleRepository;
import com.church.chms.repository.UserAuthenticationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@Transactional(readOnly = true)
public class MemberServiceImpl implements MemberService {

    private static final String DEFAULT_GENDER = "Male";
    private static final String DEFAULT_OCCUPATION = "Not Applicable";
    private static final String DEFAULT_PHONE_TYPE = "Mobile";
    private static final long DEFAULT_BRANCH_ID = 1L;

    private final ChurchMemberRepository memberRepository;
    private final MemberPhoneRepository phoneRepository;
    private final UserAuthenticationRepository authRepository;
    private final MemberRoleRepository memberRoleRepository;
    private final OrmTemplate orm;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final ChmsProperties properties;
    private final Clock clock;

    public MemberServiceImpl(ChurchMemberRepository memberRepository,
                             MemberPhoneRepository phoneRepository,
                             UserAuthenticationRepository authRepository,
                             MemberRoleRepository memberRoleRepository,
                             OrmTemplate orm,
                             PasswordEncoder passwordEncoder,
                             AuditLogService auditLogService,
                             ChmsProperties properties,
                             Clock clock) {
        this.memberRepository = memberRepository;
        this.phoneRepository = phoneRepository;
        this.authRepository = authRepository;
        this.memberRoleRepository = memberRoleRepository;
        this.orm = orm;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long register(MemberRegistrationRequest request) {
        if (authRepository.existsByUsername(request.getUsername())) {
            throw new BadRequestException("Username already exists");
        }
        checkPhonesAvailable(request.getPhones());

        ChurchMember member = new ChurchMember();
        applyProfile(member, request);
        member.setMembershipStatus(ChurchMember.STATUS_ACTIVE);
        member.setRegistrationDate(LocalDate.now(clock));
        member.setDeleted(false);
        Long memberId = memberRepository.save(member).getMbrId();

        savePhones(memberId, request.getPhones());

        UserAuthentication auth = new UserAuthentication();
        auth.setMbrId(memberId);
        auth.setUsername(request.getUsername());
        auth.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        auth.setCreatedAt(LocalDateTime.now(clock));
        authRepository.save(auth);

        MemberRole role = new MemberRole();
        role.setMbrId(memberId);
        role.setRoleId(properties.getMembers().getDefaultRoleId());
        memberRoleRepository.save(role);

        auditLogService.logMember("create", memberId, profileChanges(member));
        log.info("成员注册成功: mbrId={}, username={}", memberId, request.getUsername());
        return memberId;
    }

    @Override
    @Transactional
    public void update(Long memberId, MemberUpdateRequest request) {
        ChurchMember member = findMember(memberId);
        applyProfile(member, request);
        memberRepository.save(member);

        if (request.getPhones() != null) {
            phoneRepository.deleteByMbrId(memberId);
            phoneRepository.flush();
            checkPhonesAvailable(request.getPhones());
            savePhones(memberId, request.getPhones());
        }

        auditLogService.logMember("update", memberId, profileChanges(member));
    }

    @Override
    @Transactional
    public void delete(Long memberId) {
        ChurchMember member = findMember(memberId);
        member.setDeleted(true);
        memberRepository.save(member);
        auditLogService.logMember("delete", memberId, Map.of("deleted", true));
        log.info("成员已软删除: mbrId={}", memberId);
    }

    @Override
    public MemberView get(Long memberId) {
        MemberView view = orm.selectOne(baseQuery().where("m.mbr_id", memberId), MemberView.class);
        if (view == null) {
            throw new ResourceNotFoundException("Member not found");
        }
        view.setPhones(phoneRepository.findByMbrIdOrderByPrimaryPhoneDescMemberPhoneIdAsc(memberId));
        return view;
    }

    @Override
    public PageResult<MemberView> getAll(int page, int limit) {
        QueryBuilder query = baseQuery()
                .orderBy("m.family_name")
                .orderBy("m.first_name")
                .orderBy("m.mbr_id");
        return orm.paginate(query, page, limit, MemberView.class);
    }

    // --- 电话 ---

    @Override
    @Transactional
    public Long addPhone(Long memberId, PhoneRequest request) {
        boolean valid = memberRepository.findByMbrIdAndDeletedFalse(memberId)
                .map(ChurchMember::isActive)
                .orElse(false);
        if (!valid) {
            throw new BadRequestException("Invalid member");
        }
        if (phoneRepository.existsByPhoneNumber(request.getPhoneNumber())) {
            throw new BadRequestException("Phone number already exists");
        }

        boolean primary = Boolean.TRUE.equals(request.getPrimary()) || phoneRepository.countByMbrId(memberId) == 0;
        if (primary) {
            phoneRepository.clearPrimary(memberId);
        }
        MemberPhone phone = new MemberPhone(null, memberId, request.getPhoneNumber(),
                phoneType(request.getPhoneType()), primary);
        return phoneRepository.save(phone).getMemberPhoneId();
    }

    @Override
    @Transactional
    public void updatePhone(Long phoneId, PhoneRequest request) {
        MemberPhone phone = phoneRepository.findById(phoneId)
                .orElseThrow(() -> new ResourceNotFoundException("Phone number not found"));
        if (phoneRepository.existsByPhoneNumberAndMemberPhoneIdNot(request.getPhoneNumber(), phoneId)) {
            throw new BadRequestException("Phone number already exists");
        }
        if (Boolean.TRUE.equals(request.getPrimary()) && !phone.isPrimaryPhone()) {
            phoneRepository.clearPrimary(phone.getMbrId());
            phone.setPrimaryPhone(true);
        }
        phone.setPhoneNumber(request.getPhoneNumber());
        if (request.getPhoneType() != null) {
            phone.setPhoneType(request.getPhoneType());
        }
        phoneRepository.save(phone);
    }

    @Override
    @Transactional
    public void deletePhone(Long phoneId) {
        MemberPhone phone = phoneRepository.findById(phoneId)
                .orElseThrow(() -> new ResourceNotFoundException("Phone number not found"));
        if (phone.isPrimaryPhone()) {
            throw new BadRequestException("Cannot delete primary phone number");
        }
        phoneRepository.delete(phone);
    }

    @Override
    public List<MemberPhone> getPhones(Long memberId) {
        findMember(memberId);
        return phoneRepository.findByMbrIdOrderByPrimaryPhoneDescMemberPhoneIdAsc(memberId);
    }

    // --- 辅助方法 ---

    private ChurchMember findMember(Long memberId) {
        return memberRepository.findByMbrIdAndDeletedFalse(memberId)
                .orElseThrow(() -> new ResourceNotFoundException("Member not found"));
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("churchmember", "m")
                .select("m.mbr_id", "m.first_name", "m.family_name", "m.other_names", "m.gender",
                        "m.email_address", "m.residential_address", "m.date_of_birth", "m.occupation",
                        "m.registration_date", "m.membership_status", "m.branch_id", "b.branch_name",
                        "m.family_id", "f.family_name AS household_name")
                .leftJoin("branch", "b", "b.branch_id = m.branch_id")
                .leftJoin("family", "f", "f.family_id = m.family_id")
                .whereRaw("m.deleted = FALSE");
    }

    private void applyProfile(ChurchMember member, MemberUpdateRequest request) {
        member.setFirstName(request.getFirstName().trim());
        member.setFamilyName(request.getFamilyName().trim());
        member.setOtherNames(request.getOtherNames());
        member.setGender(request.getGender() == null ? DEFAULT_GENDER : request.getGender());
        member.setEmailAddress(request.getEmailAddress().trim());
        member.setResidentialAddress(request.getResidentialAddress());
        member.setDateOfBirth(request.getDateOfBirth());
        member.setOccupation(isBlank(request.getOccupation()) ? DEFAULT_OCCUPATION : request.getOccupation());
        if (request.getBranchId() != null) {
            member.setBranchId(request.getBranchId());
        } else if (member.getBranchId() == null) {
            member.setBranchId(DEFAULT_BRANCH_ID);
        }
    }

    private void checkPhonesAvailable(List<PhoneRequest> phones) {
        if (phones == null) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (PhoneRequest phone : phones) {
            if (!seen.add(phone.getPhoneNumber()) || phoneRepository.existsByPhoneNumber(phone.getPhoneNumber())) {
                throw new BadRequestException("Phone number already exists");
            }
        }
    }

    /**
     * 保存电话列表：只保留第一个标记为主号码的；都未标记时第一个为主号码
     */
    private void savePhones(Long memberId, List<PhoneRequest> phones) {
        if (phones == null || phones.isEmpty()) {
            return;
        }
        int primaryIndex = 0;
        for (int i = 0; i < phones.size(); i++) {
            if (Boolean.TRUE.equals(phones.get(i).getPrimary())) {
                primaryIndex = i;
                break;
            }
        }
        for (int i = 0; i < phones.size(); i++) {
            PhoneRequest request = phones.get(i);
            phoneRepository.save(new MemberPhone(null, memberId, request.getPhoneNumber(),
                    phoneType(request.getPhoneType()), i == primaryIndex));
        }
    }

    private static String phoneType(String type) {
        return type == null ? DEFAULT_PHONE_TYPE : type;
    }

    private static Map<String, Object> profileChanges(ChurchMember member) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("first_name", member.getFirstName());
        changes.put("family_name", member.getFamilyName());
        changes.put("email_address", member.getEmailAddress());
        changes.put("branch_id", member.getBranchId());
        return changes;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
