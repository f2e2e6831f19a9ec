package com.church.chms.repository;

import com.church.chms.entity.Family;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FamilyRepository extends JpaRepository<Family, Long> {

    boolean existsByFamilyName(String familyName);

    boolean existsByFamilyNameAndFamilyIdNot(String familyName, Long familyId);
}
