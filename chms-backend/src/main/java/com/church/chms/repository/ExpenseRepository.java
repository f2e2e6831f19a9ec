package com.church.chms.repository;

import com.church.chms.entity.Expense;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExpenseRepository extends JpaRepository<Expense, Long> {

    boolean existsByExpCategoryId(Long expCategoryId);

    boolean existsByFiscalYearId(Long fiscalYearId);
}
