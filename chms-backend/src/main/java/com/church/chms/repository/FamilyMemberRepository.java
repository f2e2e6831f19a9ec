package com.church.chms.repository;

import com.church.chms.entity.FamilyMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface FamilyMemberRepository extends JpaRepository<FamilyMember, Long> {

    Optional<FamilyMember> findByFamilyIdAndMbrId(Long familyId, Long mbrId);

    boolean existsByMbrId(Long mbrId);

    long countByFamilyId(Long familyId);

    void deleteByFamilyId(Long familyId);
}
