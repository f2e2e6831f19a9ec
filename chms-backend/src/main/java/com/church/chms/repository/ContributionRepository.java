package com.church.chms.repository;

import com.church.chms.entity.Contribution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ContributionRepository extends JpaRepository<Contribution, Long> {

    Optional<Contribution> findByContributionIdAndDeletedFalse(Long contributionId);

    Optional<Contribution> findByContributionIdAndDeletedTrue(Long contributionId);

    boolean existsByFiscalYearId(Long fiscalYearId);
}
