package com.church.chms.service;

import com.church.chms.dto.ExpenseRequest;
import com.church.chms.dto.ExpenseView;
import com.church.chms.orm.PageResult;

import java.util.List;
import java.util.Map;

public interface ExpenseService {

    String REPORT_BY_CATEGORY = "by_category";
    String REPORT_BY_FISCAL_YEAR = "by_fiscal_year";
    String REPORT_PENDING_VS_APPROVED = "pending_vs_approved";
    String REPORT_BY_MONTH = "by_month";

    /**
     * 新支出状态为 Pending Approval
     */
    Long create(ExpenseRequest request);

    /**
     * 只有待审批的支出可以修改或删除
     */
    void update(Long expenseId, ExpenseRequest request);

    void delete(Long expenseId);

    ExpenseView get(Long expenseId);

    PageResult<ExpenseView> getAll(int page, int limit, Long fiscalYearId, Long categoryId, String status);

    /**
     * Pending Approval → Approved / Declined，写入审批记录并通知申请人
     */
    void review(Long expenseId, String status, String comments);

    /**
     * @param type       by_category | by_fiscal_year | pending_vs_approved | by_month
     * @param fiscalYearId by_category 与 pending_vs_approved 的可选过滤条件
     * @param year       by_month 的可选过滤条件
     */
    List<Map<String, Object>> getReport(String type, Long fiscalYearId, Integer year);
}
