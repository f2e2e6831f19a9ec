package com.church.chms.repository;

import com.church.chms.entity.ChurchGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChurchGroupRepository extends JpaRepository<ChurchGroup, Long> {

    boolean existsByGroupName(String groupName);

    boolean existsByGroupNameAndGroupIdNot(String groupName, Long groupId);

    boolean existsByGroupTypeId(Long groupTypeId);
}
