package com.church.chms.service;

import com.church.chms.dto.BudgetVsActual;
import com.church.chms.dto.IncomeStatement;

/**
 * 财务报表
 */
public interface FinanceService {

    IncomeStatement getIncomeStatement(Long fiscalYearId);

    BudgetVsActual getBudgetVsActual(Long fiscalYearId);
}
