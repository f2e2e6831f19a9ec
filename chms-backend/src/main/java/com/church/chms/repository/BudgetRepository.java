package com.church.chms.repository;

import com.church.chms.entity.Budget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, Long> {

    boolean existsByFiscalYearId(Long fiscalYearId);

    boolean existsByExpCategoryId(Long expCategoryId);
}
