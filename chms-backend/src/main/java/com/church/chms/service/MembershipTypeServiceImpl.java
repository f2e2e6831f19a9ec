package com.church.chms.service;

import com.church.chms.dto.AssignmentFilter;
import com.church.chms.dto.MembershipAssignmentRequest;
import com.church.chms.dto.MembershipAssignmentView;
import com.church.chms.dto.MembershipTypeRequest;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.MemberMembershipType;
import com.church.chms.entity.MembershipType;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.MemberMembershipTypeRepository;
import com.church.chms.repository.MembershipTypeRepository;
import com.church.chms.security.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@Transactional(readOnly = true)
public class MembershipTypeServiceImpl implements MembershipTypeService {

    private final MembershipTypeRepository typeRepository;
    private final MemberMembershipTypeRepository assignmentRepository;
    private final ChurchMemberRepository memberRepository;
    private final CommunicationService communicationService;
    private final OrmTemplate orm;
    private final RequestContext requestContext;

    public MembershipTypeServiceImpl(MembershipTypeRepository typeRepository,
                                     MemberMembershipTypeRepository assignmentRepository,
                                     ChurchMemberRepository memberRepository,
                                     CommunicationService communicationService,
                                     OrmTemplate orm,
                                     RequestContext requestContext) {
        this.typeRepository = typeRepository;
        this.assignmentRepository = assignmentRepository;
        this.memberRepository = memberRepository;
        this.communicationService = communicationService;
        this.orm = orm;
        this.requestContext = requestContext;
    }

    @Override
    @Transactional
    public Long createType(MembershipTypeRequest request) {
        if (typeRepository.existsByTypeName(request.getTypeName())) {
            throw new BadRequestException("Membership type name already exists");
        }
        Long id = typeRepository.save(new MembershipType(null, request.getTypeName(), request.getDescription()))
                .getMembershipTypeId();
        communicationService.notify("Membership Type Created",
                "Membership type '" + request.getTypeName() + "' has been created.", currentMember(), null, null);
        return id;
    }

    @Override
    @Transactional
    public void updateType(Long typeId, MembershipTypeRequest request) {
        MembershipType type = findType(typeId);
        if (typeRepository.existsByTypeNameAndMembershipTypeIdNot(request.getTypeName(), typeId)) {
            throw new BadRequestException("Membership type name already exists");
        }
        type.setTypeName(request.getTypeName());
        if (request.getDescription() != null) {
            type.setDescription(request.getDescription());
        }
        typeRepository.save(type);
        communicationService.notify("Membership Type Updated",
                "Membership type '" + request.getTypeName() + "' has been updated.", currentMember(), null, null);
    }

    @Override
    @Transactional
    public void deleteType(Long typeId) {
        MembershipType type = findType(typeId);
        if (assignmentRepository.existsByMembershipTypeId(typeId)) {
            throw new BadRequestException("Cannot delete membership type assigned to members");
        }
        typeRepository.delete(type);
        communicationService.notify("Membership Type Deleted",
                "Membership type '" + type.getTypeName() + "' has been deleted.", currentMember(), null, null);
    }

    @Override
    public MembershipType getType(Long typeId) {
        return findType(typeId);
    }

    @Override
    public PageResult<MembershipType> getAllTypes(int page, int limit, String name) {
        QueryBuilder query = QueryBuilder.from("membership_type", "mt")
                .select("mt.membership_type_id", "mt.type_name", "mt.description")
                .whereIfPresent("mt.type_name", "LIKE", name == null ? null : "%" + name.trim() + "%")
                .orderBy("mt.type_name");
        return orm.paginate(query, page, limit, MembershipType.class);
    }

    @Override
    @Transactional
    public Long assignType(Long memberId, MembershipAssignmentRequest request) {
        boolean active = memberRepository.findByMbrIdAndDeletedFalse(memberId)
                .map(ChurchMember::isActive)
                .orElse(false);
        if (!active) {
            throw new BadRequestException("Invalid or inactive member");
        }
        MembershipType type = typeRepository.findById(request.getTypeId())
                .orElseThrow(() -> new BadRequestException("Invalid membership type"));
        if (assignmentRepository.existsByMbrIdAndEndDateIsNull(memberId)) {
            throw new BadRequestException("Member already has an active membership type");
        }
        if (assignmentRepository.countOverlapping(memberId, request.getStartDate()) > 0) {
            throw new BadRequestException("Membership assignment overlaps with an existing assignment");
        }

        Long id = assignmentRepository.save(new MemberMembershipType(null, memberId, type.getMembershipTypeId(),
                request.getStartDate(), null)).getAssignmentId();
        communicationService.notify("Membership Type Assigned",
                "You have been assigned membership type '" + type.getTypeName() + "'.", currentMember(), null, memberId);
        log.info("会籍分配成功: mbrId={}, type={}", memberId, type.getTypeName());
        return id;
    }

    @Override
    @Transactional
    public void updateAssignment(Long assignmentId, LocalDate endDate) {
        MemberMembershipType assignment = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Membership assignment not found"));
        if (endDate.isBefore(assignment.getStartDate())) {
            throw new BadRequestException("End date cannot be before start date");
        }
        if (assignmentRepository.countOverlappingExcluding(assignment.getMbrId(), assignmentId,
                assignment.getStartDate(), endDate) > 0) {
            throw new BadRequestException("Membership assignment overlaps with an existing assignment");
        }
        assignment.setEndDate(endDate);
        assignmentRepository.save(assignment);

        String typeName = typeRepository.findById(assignment.getMembershipTypeId())
                .map(MembershipType::getTypeName)
                .orElse("");
        communicationService.notify("Membership Type Assignment Updated",
                "Your membership type '" + typeName + "' assignment has been updated.",
                currentMember(), null, assignment.getMbrId());
        log.info("会籍分配已更新: assignmentId={}, endDate={}", assignmentId, endDate);
    }

    @Override
    public List<MembershipAssignmentView> getMemberAssignments(Long memberId, AssignmentFilter filter) {
        QueryBuilder query = QueryBuilder.from("member_membership_type", "mmt")
                .select("mmt.assignment_id", "mmt.mbr_id", "mmt.membership_type_id", "mt.type_name",
                        "mmt.start_date", "mmt.end_date")
                .join("membership_type", "mt", "mt.membership_type_id = mmt.membership_type_id")
                .where("mmt.mbr_id", memberId);
        if (filter != null) {
            if (Boolean.TRUE.equals(filter.getActive())) {
                query.whereRaw("mmt.end_date IS NULL");
            }
            // 区间过滤按分配开始日期
            query.whereIfPresent("mmt.start_date", ">=", filter.getStartDate())
                    .whereIfPresent("mmt.start_date", "<=", filter.getEndDate());
        }
        query.orderBy("mmt.start_date", "DESC");
        return orm.select(query, MembershipAssignmentView.class);
    }

    private MembershipType findType(Long typeId) {
        return typeRepository.findById(typeId)
                .orElseThrow(() -> new ResourceNotFoundException("Membership type not found"));
    }

    private Long currentMember() {
        return requestContext.currentMemberId().orElse(null);
    }
}
