package com.church.chms.repository;

import com.church.chms.entity.MembershipType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MembershipTypeRepository extends JpaRepository<MembershipType, Long> {

    boolean existsByTypeName(String typeName);

    boolean existsByTypeNameAndMembershipTypeIdNot(String typeName, Long membershipTypeId);
}
