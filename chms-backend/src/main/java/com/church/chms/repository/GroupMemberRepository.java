package com.church.chms.repository;

import com.church.chms.entity.GroupMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GroupMemberRepository extends JpaRepository<GroupMember, Long> {

    boolean existsByGroupIdAndMbrId(Long groupId, Long mbrId);

    Optional<GroupMember> findByGroupIdAndMbrId(Long groupId, Long mbrId);

    boolean existsByGroupId(Long groupId);

    List<GroupMember> findByGroupId(Long groupId);
}
