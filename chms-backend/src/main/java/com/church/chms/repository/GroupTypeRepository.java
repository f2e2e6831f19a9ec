package com.church.chms.repository;

import com.church.chms.entity.GroupType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GroupTypeRepository extends JpaRepository<GroupType, Long> {

    boolean existsByTypeName(String typeName);

    boolean existsByTypeNameAndGroupTypeIdNot(String typeName, Long groupTypeId);
}
