package com.church.chms.repository;

import com.church.chms.entity.ExpenseApproval;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExpenseApprovalRepository extends JpaRepository<ExpenseApproval, Long> {

    List<ExpenseApproval> findByExpenseIdOrderByApprovalDateDesc(Long expenseId);
}
