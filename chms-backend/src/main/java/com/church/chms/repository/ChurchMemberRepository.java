package com.church.chms.repository;

import com.church.chms.entity.ChurchMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChurchMemberRepository extends JpaRepository<ChurchMember, Long> {

    Optional<ChurchMember> findByMbrIdAndDeletedFalse(Long mbrId);

    List<ChurchMember> findByFamilyId(Long familyId);
}
