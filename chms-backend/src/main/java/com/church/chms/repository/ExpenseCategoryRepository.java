package com.church.chms.repository;

import com.church.chms.entity.ExpenseCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExpenseCategoryRepository extends JpaRepository<ExpenseCategory, Long> {

    boolean existsByCategoryName(String categoryName);

    boolean existsByCategoryNameAndExpCategoryIdNot(String categoryName, Long expCategoryId);
}
