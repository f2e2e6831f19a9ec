package com.church.chms.service;

import com.church.chms.dto.VolunteerAssignmentRequest;
import com.church.chms.dto.VolunteerAssignmentResult;
import com.church.chms.dto.VolunteerRoleRequest;
import com.church.chms.dto.VolunteerView;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.EventVolunteer;
import com.church.chms.entity.VolunteerRole;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ForbiddenException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.EventRepository;
import com.church.chms.repository.EventVolunteerRepository;
import com.church.chms.repository.VolunteerRoleRepository;
import com.church.chms.security.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@Transactional(readOnly = true)
public class VolunteerServiceImpl implements VolunteerService {

    private final VolunteerRoleRepository roleRepository;
    private final EventVolunteerRepository assignmentRepository;
    private final EventRepository eventRepository;
    private final ChurchMemberRepository memberRepository;
    private final OrmTemplate orm;
    private final RequestContext requestContext;
    private final Clock clock;

    public VolunteerServiceImpl(VolunteerRoleRepository roleRepository,
                                EventVolunteerRepository assignmentRepository,
                                EventRepository eventRepository,
                                ChurchMemberRepository memberRepository,
                                OrmTemplate orm,
                                RequestContext requestContext,
                                Clock clock) {
        this.roleRepository = roleRepository;
        this.assignmentRepository = assignmentRepository;
        this.eventRepository = eventRepository;
        this.memberRepository = memberRepository;
        this.orm = orm;
        this.requestContext = requestContext;
        this.clock = clock;
    }

    @Override
    public List<VolunteerRole> getRoles() {
        return roleRepository.findAllByOrderByRoleNameAsc();
    }

    @Override
    @Transactional
    public Long createRole(VolunteerRoleRequest request) {
        String name = request.getName().trim();
        if (roleRepository.existsByRoleName(name)) {
            throw new BadRequestException("Volunteer role already exists");
        }
        return roleRepository.save(new VolunteerRole(null, name, request.getDescription())).getVolunteerRoleId();
    }

    @Override
    @Transactional
    public VolunteerAssignmentResult assign(Long eventId, VolunteerAssignmentRequest request) {
        if (!eventRepository.existsById(eventId)) {
            throw new ResourceNotFoundException("Event not found");
        }
        if (request.getVolunteers() == null || request.getVolunteers().isEmpty()) {
            throw new BadRequestException("Volunteers list is required");
        }
        Long assignedBy = requestContext.requireMemberId();
        LocalDateTime now = LocalDateTime.now(clock);

        int assigned = 0;
        List<Long> skipped = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (VolunteerAssignmentRequest.Entry entry : request.getVolunteers()) {
            Long memberId = entry.getMemberId();
            boolean active = memberRepository.findByMbrIdAndDeletedFalse(memberId)
                    .map(ChurchMember::isActive)
                    .orElse(false);
            // 抛出异常即回滚本批次已写入的分配
            if (!active) {
                throw new BadRequestException("Invalid or inactive member: " + memberId);
            }
            if (entry.getRoleId() != null && !roleRepository.existsById(entry.getRoleId())) {
                throw new BadRequestException("Invalid volunteer role: " + entry.getRoleId());
            }
            if (!seen.add(memberId) || assignmentRepository.existsByEventIdAndMbrId(eventId, memberId)) {
                skipped.add(memberId);
                continue;
            }

            EventVolunteer volunteer = new EventVolunteer();
            volunteer.setEventId(eventId);
            volunteer.setMbrId(memberId);
            volunteer.setVolunteerRoleId(entry.getRoleId());
            volunteer.setNotes(entry.getNotes());
            volunteer.setAssignedBy(assignedBy);
            volunteer.setStatus(EventVolunteer.STATUS_PENDING);
            volunteer.setAssignedAt(now);
            assignmentRepository.save(volunteer);
            assigned++;
        }

        log.info("活动 {} 分配志愿者 {} 名, 跳过 {} 名", eventId, assigned, skipped.size());
        return new VolunteerAssignmentResult(assigned, skipped);
    }

    @Override
    @Transactional
    public void confirmAssignment(Long assignmentId, String action) {
        EventVolunteer volunteer = findAssignment(assignmentId);
        Long memberId = requestContext.requireMemberId();
        if (!volunteer.getMbrId().equals(memberId)) {
            throw new ForbiddenException("Only the assigned member can respond to this assignment");
        }
        if (!EventVolunteer.STATUS_PENDING.equals(volunteer.getStatus())) {
            throw new BadRequestException("Assignment has already been responded to");
        }
        volunteer.setStatus("confirm".equals(action) ? EventVolunteer.STATUS_CONFIRMED : EventVolunteer.STATUS_DECLINED);
        volunteer.setRespondedAt(LocalDateTime.now(clock));
        assignmentRepository.save(volunteer);
    }

    @Override
    @Transactional
    public void completeAssignment(Long assignmentId) {
        EventVolunteer volunteer = findAssignment(assignmentId);
        if (!EventVolunteer.STATUS_CONFIRMED.equals(volunteer.getStatus())) {
            throw new BadRequestException("Only confirmed assignments can be completed");
        }
        volunteer.setStatus(EventVolunteer.STATUS_COMPLETED);
        assignmentRepository.save(volunteer);
    }

    @Override
    @Transactional
    public void remove(Long assignmentId) {
        assignmentRepository.delete(findAssignment(assignmentId));
    }

    @Override
    public PageResult<VolunteerView> getByEvent(Long eventId, int page, int limit) {
        if (!eventRepository.existsById(eventId)) {
            throw new ResourceNotFoundException("Event not found");
        }
        QueryBuilder query = QueryBuilder.from("event_volunteer", "ev")
                .select("ev.event_volunteer_id", "ev.event_id", "ev.mbr_id",
                        "CONCAT(m.first_name, ' ', m.family_name) AS member_name",
                        "ev.volunteer_role_id", "vr.role_name", "ev.status", "ev.notes",
                        "ev.assigned_by", "ev.assigned_at", "ev.responded_at")
                .join("churchmember", "m", "m.mbr_id = ev.mbr_id")
                .leftJoin("volunteer_role", "vr", "vr.volunteer_role_id = ev.volunteer_role_id")
                .where("ev.event_id", eventId)
                .orderBy("ev.assigned_at", "DESC")
                .orderBy("ev.event_volunteer_id", "DESC");
        return orm.paginate(query, page, limit, VolunteerView.class);
    }

    private EventVolunteer findAssignment(Long assignmentId) {
        return assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Volunteer assignment not found"));
    }
}
