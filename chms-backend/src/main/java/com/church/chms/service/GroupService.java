package com.church.chms.service;

import com.church.chms.dto.CommunicationView;
import com.church.chms.dto.GroupMemberView;
import com.church.chms.dto.GroupMessageRequest;
import com.church.chms.dto.GroupRequest;
import com.church.chms.dto.GroupView;
import com.church.chms.orm.PageResult;

public interface GroupService {

    Long create(GroupRequest request);

    void update(Long groupId, GroupRequest request);

    void delete(Long groupId);

    GroupView get(Long groupId);

    PageResult<GroupView> getAll(int page, int limit, Long typeId, Long branchId, String name);

    void addMember(Long groupId, Long memberId);

    void removeMember(Long groupId, Long memberId);

    /**
     * 向全体组员发送消息，返回 communication_id
     */
    Long sendMessage(Long groupId, GroupMessageRequest request);

    PageResult<CommunicationView> getMessages(Long groupId, int page, int limit);

    PageResult<GroupMemberView> getMembers(Long groupId, int page, int limit);
}
