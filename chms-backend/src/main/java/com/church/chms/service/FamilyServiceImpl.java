package com.church.chms.service;

import com.church.chms.dto.FamilyCreateRequest;
import com.church.chms.dto.FamilyMemberView;
import com.church.chms.dto.FamilyUpdateRequest;
import com.church.chms.dto.FamilyView;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.Family;
import com.church.chms.entity.FamilyMember;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.BranchRepository;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.FamilyMemberRepository;
import com.church.chms.repository.FamilyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 家庭管理：每个家庭恰好一个户主 (Head)，成员同一时间只属于一个家庭
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class FamilyServiceImpl implements FamilyService {

    private static final Set<String> ROLES = Set.of("Head", "Spouse", "Child", "Other");

    private final FamilyRepository familyRepository;
    private final FamilyMemberRepository familyMemberRepository;
    private final ChurchMemberRepository memberRepository;
    private final BranchRepository branchRepository;
    private final OrmTemplate orm;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public FamilyServiceImpl(FamilyRepository familyRepository,
                             FamilyMemberRepository familyMemberRepository,
                             ChurchMemberRepository memberRepository,
                             BranchRepository branchRepository,
                             OrmTemplate orm,
                             AuditLogService auditLogService,
                             Clock clock) {
        this.familyRepository = familyRepository;
        this.familyMemberRepository = familyMemberRepository;
        this.memberRepository = memberRepository;
        this.branchRepository = branchRepository;
        this.orm = orm;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long create(FamilyCreateRequest request) {
        ChurchMember head = memberRepository.findByMbrIdAndDeletedFalse(request.getHeadOfHouseholdId())
                .filter(ChurchMember::isActive)
                .orElseThrow(() -> new BadRequestException("Invalid or inactive head of household"));
        if (!branchRepository.existsById(request.getBranchId())) {
            throw new BadRequestException("Invalid branch ID");
        }
        if (!Objects.equals(head.getBranchId(), request.getBranchId())) {
            throw new BadRequestException("Head of household must belong to the selected branch");
        }
        String name = request.getFamilyName().trim();
        if (familyRepository.existsByFamilyName(name)) {
            throw new BadRequestException("Family name already exists");
        }
        if (head.getFamilyId() != null || familyMemberRepository.existsByMbrId(head.getMbrId())) {
            throw new BadRequestException("Head of household already belongs to a family");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Family family = familyRepository.save(new Family(null, name, head.getMbrId(), request.getBranchId(), now));
        familyMemberRepository.save(new FamilyMember(null, family.getFamilyId(), head.getMbrId(), FamilyMember.ROLE_HEAD, now));
        head.setFamilyId(family.getFamilyId());
        memberRepository.save(head);

        auditLogService.log("create", "family", family.getFamilyId(),
                Map.of("family_name", name, "head_of_household_id", head.getMbrId()), null);
        log.info("家庭创建成功: familyId={}, name={}", family.getFamilyId(), name);
        return family.getFamilyId();
    }

    @Override
    @Transactional
    public void update(Long familyId, FamilyUpdateRequest request) {
        Family family = findFamily(familyId);
        Map<String, Object> changes = new LinkedHashMap<>();

        if (request.getFamilyName() != null && !request.getFamilyName().isBlank()) {
            String name = request.getFamilyName().trim();
            if (familyRepository.existsByFamilyNameAndFamilyIdNot(name, familyId)) {
                throw new BadRequestException("Family name already exists");
            }
            if (!name.equals(family.getFamilyName())) {
                family.setFamilyName(name);
                changes.put("family_name", name);
            }
        }
        if (request.getBranchId() != null && !request.getBranchId().equals(family.getBranchId())) {
            if (!branchRepository.existsById(request.getBranchId())) {
                throw new BadRequestException("Invalid branch ID");
            }
            family.setBranchId(request.getBranchId());
            changes.put("branch_id", request.getBranchId());
        }

        if (changes.isEmpty()) {
            return;
        }
        familyRepository.save(family);
        auditLogService.log("update", "family", familyId, changes, null);
    }

    @Override
    @Transactional
    public void delete(Long familyId) {
        Family family = findFamily(familyId);
        if (familyMemberRepository.countByFamilyId(familyId) > 1) {
            throw new BadRequestException("Cannot delete family with multiple members");
        }
        familyMemberRepository.deleteByFamilyId(familyId);
        for (ChurchMember member : memberRepository.findByFamilyId(familyId)) {
            member.setFamilyId(null);
            memberRepository.save(member);
        }
        familyRepository.delete(family);
        auditLogService.log("delete", "family", familyId, Map.of("family_name", family.getFamilyName()), null);
    }

    @Override
    public FamilyView get(Long familyId) {
        FamilyView view = orm.selectOne(baseQuery().where("f.family_id", familyId), FamilyView.class);
        if (view == null) {
            throw new ResourceNotFoundException("Family not found");
        }
        QueryBuilder members = QueryBuilder.from("family_member", "fm")
                .select("m.mbr_id", "m.first_name", "m.family_name", "m.gender", "m.date_of_birth",
                        "fm.family_role", "fm.joined_at")
                .join("churchmember", "m", "m.mbr_id = fm.mbr_id")
                .where("fm.family_id", familyId)
                .orderBy("fm.joined_at");
        view.setMembers(orm.select(members, FamilyMemberView.class));
        return view;
    }

    @Override
    public PageResult<FamilyView> getAll(int page, int limit, Long branchId, String name) {
        QueryBuilder query = baseQuery()
                .whereIfPresent("f.branch_id", branchId)
                .whereIfPresent("f.family_name", "LIKE", name == null ? null : "%" + name.trim() + "%")
                .orderBy("f.family_name");
        return orm.paginate(query, page, limit, FamilyView.class);
    }

    @Override
    @Transactional
    public void addMember(Long familyId, Long memberId, String role) {
        findFamily(familyId);
        if (FamilyMember.ROLE_HEAD.equals(role)) {
            throw new BadRequestException("Cannot assign Head role – use family creation/update");
        }
        requireValidRole(role);
        ChurchMember member = memberRepository.findByMbrIdAndDeletedFalse(memberId)
                .filter(ChurchMember::isActive)
                .orElseThrow(() -> new BadRequestException("Invalid or inactive member"));
        if (familyMemberRepository.findByFamilyIdAndMbrId(familyId, memberId).isPresent()) {
            throw new BadRequestException("Member is already in this family");
        }
        if (member.getFamilyId() != null || familyMemberRepository.existsByMbrId(memberId)) {
            throw new BadRequestException("Member already belongs to another family");
        }

        familyMemberRepository.save(new FamilyMember(null, familyId, memberId, role, LocalDateTime.now(clock)));
        member.setFamilyId(familyId);
        memberRepository.save(member);
        auditLogService.log("add_member", "family", familyId, Map.of("mbr_id", memberId, "role", role), null);
    }

    @Override
    @Transactional
    public void removeMember(Long familyId, Long memberId) {
        Family family = findFamily(familyId);
        if (family.getHeadOfHouseholdId().equals(memberId)) {
            throw new BadRequestException("Cannot remove head of household");
        }
        FamilyMember membership = familyMemberRepository.findByFamilyIdAndMbrId(familyId, memberId)
                .orElseThrow(() -> new BadRequestException("Member is not in this family"));
        familyMemberRepository.delete(membership);
        memberRepository.findById(memberId).ifPresent(member -> {
            member.setFamilyId(null);
            memberRepository.save(member);
        });
        auditLogService.log("remove_member", "family", familyId, Map.of("mbr_id", memberId), null);
    }

    @Override
    @Transactional
    public void updateMemberRole(Long familyId, Long memberId, String role) {
        Family family = findFamily(familyId);
        requireValidRole(role);
        FamilyMember membership = familyMemberRepository.findByFamilyIdAndMbrId(familyId, memberId)
                .orElseThrow(() -> new BadRequestException("Member is not in this family"));

        boolean isHead = family.getHeadOfHouseholdId().equals(memberId);
        if (isHead && !FamilyMember.ROLE_HEAD.equals(role)) {
            throw new BadRequestException("Cannot change the role of the head of household");
        }
        if (!isHead && FamilyMember.ROLE_HEAD.equals(role)) {
            throw new BadRequestException("Family can only have one head");
        }
        membership.setFamilyRole(role);
        familyMemberRepository.save(membership);
    }

    private Family findFamily(Long familyId) {
        return familyRepository.findById(familyId)
                .orElseThrow(() -> new ResourceNotFoundException("Family not found"));
    }

    private static void requireValidRole(String role) {
        if (!ROLES.contains(role)) {
            throw new BadRequestException("Invalid family role. Must be one of: Head, Spouse, Child, Other");
        }
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("family", "f")
                .select("f.family_id", "f.family_name", "f.head_of_household_id",
                        "CONCAT(h.first_name, ' ', h.family_name) AS head_name",
                        "f.branch_id", "b.branch_name", "f.created_at",
                        "(SELECT COUNT(*) FROM family_member fm WHERE fm.family_id = f.family_id) AS member_count")
                .leftJoin("churchmember", "h", "h.mbr_id = f.head_of_household_id")
                .leftJoin("branch", "b", "b.branch_id = f.branch_id");
    }
}
