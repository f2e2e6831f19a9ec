package com.church.chms.service;

import com.church.chms.dto.CommunicationView;
import com.church.chms.dto.GroupMemberView;
import com.church.chms.dto.GroupMessageRequest;
import com.church.chms.dto.GroupRequest;
import com.church.chms.dto.GroupView;
import com.church.chms.entity.ChurchGroup;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.GroupMember;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchGroupRepository;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.CommunicationRepository;
import com.church.chms.repository.GroupMemberRepository;
import com.church.chms.repository.GroupTypeRepository;
import com.church.chms.security.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 小组管理。小组生命周期通知发给组长或相关成员本人；
 * 只有发给整个小组的消息 (target_group_id) 会阻止删除小组。
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class GroupServiceImpl implements GroupService {

    private final ChurchGroupRepository groupRepository;
    private final GroupMemberRepository groupMemberRepository;
    private final GroupTypeRepository groupTypeRepository;
    private final ChurchMemberRepository memberRepository;
    private final CommunicationRepository communicationRepository;
    private final CommunicationService communicationService;
    private final OrmTemplate orm;
    private final RequestContext requestContext;
    private final Clock clock;

    public GroupServiceImpl(ChurchGroupRepository groupRepository,
                            GroupMemberRepository groupMemberRepository,
                            GroupTypeRepository groupTypeRepository,
                            ChurchMemberRepository memberRepository,
                            CommunicationRepository communicationRepository,
                            CommunicationService communicationService,
                            OrmTemplate orm,
                            RequestContext requestContext,
                            Clock clock) {
        this.groupRepository = groupRepository;
        this.groupMemberRepository = groupMemberRepository;
        this.groupTypeRepository = groupTypeRepository;
        this.memberRepository = memberRepository;
        this.communicationRepository = communicationRepository;
        this.communicationService = communicationService;
        this.orm = orm;
        this.requestContext = requestContext;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long create(GroupRequest request) {
        validate(request);
        String name = request.getGroupName().trim();
        if (groupRepository.existsByGroupName(name)) {
            throw new BadRequestException("Group name already exists");
        }

        ChurchGroup group = new ChurchGroup(null, name, request.getLeaderId(), request.getTypeId(),
                request.getDescription(), LocalDateTime.now(clock));
        Long groupId = groupRepository.save(group).getGroupId();

        communicationService.notify("New Group Created", "Group '" + name + "' has been created.",
                sender(request.getLeaderId()), null, request.getLeaderId());
        log.info("小组创建成功: groupId={}, name={}", groupId, name);
        return groupId;
    }

    @Override
    @Transactional
    public void update(Long groupId, GroupRequest request) {
        ChurchGroup group = findGroup(groupId);
        validate(request);
        String name = request.getGroupName().trim();
        if (groupRepository.existsByGroupNameAndGroupIdNot(name, groupId)) {
            throw new BadRequestException("Group name already exists");
        }

        group.setGroupName(name);
        group.setGroupLeaderId(request.getLeaderId());
        group.setGroupTypeId(request.getTypeId());
        if (request.getDescription() != null) {
            group.setGroupDescription(request.getDescription());
        }
        groupRepository.save(group);

        communicationService.notify("Group Updated", "Group '" + name + "' has been updated.",
                sender(request.getLeaderId()), null, request.getLeaderId());
    }

    @Override
    @Transactional
    public void delete(Long groupId) {
        ChurchGroup group = findGroup(groupId);
        if (groupMemberRepository.existsByGroupId(groupId) || communicationRepository.existsByTargetGroupId(groupId)) {
            throw new BadRequestException("Cannot delete group with members or communications");
        }
        groupRepository.delete(group);
        log.info("小组已删除: groupId={}", groupId);
    }

    @Override
    public GroupView get(Long groupId) {
        GroupView view = orm.selectOne(baseQuery().where("g.group_id", groupId), GroupView.class);
        if (view == null) {
            throw new ResourceNotFoundException("Group not found");
        }
        return view;
    }

    @Override
    public PageResult<GroupView> getAll(int page, int limit, Long typeId, Long branchId, String name) {
        QueryBuilder query = baseQuery()
                .whereIfPresent("g.group_type_id", typeId)
                .whereIfPresent("l.branch_id", branchId)
                .whereIfPresent("g.group_name", "LIKE", name == null ? null : "%" + name.trim() + "%")
                .orderBy("g.group_name");
        return orm.paginate(query, page, limit, GroupView.class);
    }

    @Override
    @Transactional
    public void addMember(Long groupId, Long memberId) {
        ChurchGroup group = findGroup(groupId);
        requireActiveMember(memberId, "Invalid or inactive member");
        if (groupMemberRepository.existsByGroupIdAndMbrId(groupId, memberId)) {
            throw new BadRequestException("Member is already in this group");
        }
        groupMemberRepository.save(new GroupMember(null, groupId, memberId, LocalDateTime.now(clock)));

        communicationService.notify("Added to Group",
                "You have been added to group '" + group.getGroupName() + "'.",
                group.getGroupLeaderId(), null, memberId);
    }

    @Override
    @Transactional
    public void removeMember(Long groupId, Long memberId) {
        ChurchGroup group = findGroup(groupId);
        GroupMember membership = groupMemberRepository.findByGroupIdAndMbrId(groupId, memberId)
                .orElseThrow(() -> new BadRequestException("Member is not in this group"));
        if (group.getGroupLeaderId().equals(memberId)) {
            throw new BadRequestException("Cannot remove group leader as a member");
        }
        groupMemberRepository.delete(membership);

        communicationService.notify("Removed from Group",
                "You have been removed from group '" + group.getGroupName() + "'.",
                group.getGroupLeaderId(), null, memberId);
    }

    @Override
    @Transactional
    public Long sendMessage(Long groupId, GroupMessageRequest request) {
        findGroup(groupId);
        Long senderId = request.getSentBy() != null ? request.getSentBy() : requestContext.requireMemberId();
        requireActiveMember(senderId, "Invalid or inactive sender");

        List<Long> recipients = groupMemberRepository.findByGroupId(groupId).stream()
                .map(GroupMember::getMbrId)
                .collect(Collectors.toList());
        return communicationService.send(request.getTitle(), request.getMessage(), senderId, groupId,
                recipients, request.getChannels());
    }

    @Override
    public PageResult<CommunicationView> getMessages(Long groupId, int page, int limit) {
        findGroup(groupId);
        QueryBuilder query = QueryBuilder.from("communication", "c")
                .select("c.communication_id", "c.title", "c.message", "c.sent_by",
                        "CONCAT(m.first_name, ' ', m.family_name) AS sender_name",
                        "c.target_group_id", "c.target_member_id", "c.created_at")
                .leftJoin("churchmember", "m", "m.mbr_id = c.sent_by")
                .where("c.target_group_id", groupId)
                .orderBy("c.created_at", "DESC")
                .orderBy("c.communication_id", "DESC");
        return orm.paginate(query, page, limit, CommunicationView.class);
    }

    @Override
    public PageResult<GroupMemberView> getMembers(Long groupId, int page, int limit) {
        findGroup(groupId);
        QueryBuilder query = QueryBuilder.from("groupmember", "gm")
                .select("m.mbr_id", "m.first_name", "m.family_name", "m.email_address", "gm.joined_at")
                .join("churchmember", "m", "m.mbr_id = gm.mbr_id")
                .where("gm.group_id", groupId)
                .whereRaw("m.deleted = FALSE")
                .orderBy("m.family_name")
                .orderBy("m.first_name");
        return orm.paginate(query, page, limit, GroupMemberView.class);
    }

    private void validate(GroupRequest request) {
        requireActiveMember(request.getLeaderId(), "Invalid or inactive group leader");
        if (!groupTypeRepository.existsById(request.getTypeId())) {
            throw new BadRequestException("Invalid group type");
        }
    }

    private void requireActiveMember(Long memberId, String message) {
        boolean active = memberRepository.findByMbrIdAndDeletedFalse(memberId)
                .map(ChurchMember::isActive)
                .orElse(false);
        if (!active) {
            throw new BadRequestException(message);
        }
    }

    private ChurchGroup findGroup(Long groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group not found"));
    }

    private Long sender(Long fallback) {
        return requestContext.currentMemberId().orElse(fallback);
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("churchgroup", "g")
                .select("g.group_id", "g.group_name", "g.group_description", "g.group_leader_id",
                        "CONCAT(l.first_name, ' ', l.family_name) AS leader_name",
                        "g.group_type_id", "t.type_name", "l.branch_id", "b.branch_name",
                        "(SELECT COUNT(*) FROM groupmember gm WHERE gm.group_id = g.group_id) AS member_count",
                        "g.created_at")
                .leftJoin("churchmember", "l", "l.mbr_id = g.group_leader_id")
                .leftJoin("grouptype", "t", "t.group_type_id = g.group_type_id")
                .leftJoin("branch", "b", "b.branch_id = l.branch_id");
    }
}
