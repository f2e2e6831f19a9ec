package com.church.chms.repository;

import com.church.chms.entity.ContributionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ContributionTypeRepository extends JpaRepository<ContributionType, Long> {
}
