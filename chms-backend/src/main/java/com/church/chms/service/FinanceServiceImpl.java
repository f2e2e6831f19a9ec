package com.church.chms.service;

import com.church.chms.dto.BudgetVsActual;
import com.church.chms.dto.IncomeStatement;
import com.church.chms.entity.Expense;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.FiscalYearRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class FinanceServiceImpl implements FinanceService {

    private final OrmTemplate orm;
    private final FiscalYearRepository fiscalYearRepository;

    public FinanceServiceImpl(OrmTemplate orm, FiscalYearRepository fiscalYearRepository) {
        this.orm = orm;
        this.fiscalYearRepository = fiscalYearRepository;
    }

    @Override
    public IncomeStatement getIncomeStatement(Long fiscalYearId) {
        requireFiscalYear(fiscalYearId);

        // 收入：未删除的奉献，按类型汇总
        QueryBuilder incomeQuery = QueryBuilder.from("contribution", "c")
                .select("ct.contribution_type_id AS id", "ct.type_name AS name", "SUM(c.amount) AS total")
                .join("contributiontype", "ct", "ct.contribution_type_id = c.contribution_type_id")
                .where("c.fiscal_year_id", fiscalYearId)
                .whereRaw("c.deleted = FALSE")
                .groupBy("ct.contribution_type_id", "ct.type_name")
                .orderBy("ct.type_name");
        List<IncomeStatement.Line> income = toLines(orm.select(incomeQuery));

        // 支出：已批准的支出，按类别汇总
        QueryBuilder expenseQuery = QueryBuilder.from("expense", "e")
                .select("ec.exp_category_id AS id", "ec.category_name AS name", "SUM(e.amount) AS total")
                .join("expensecategory", "ec", "ec.exp_category_id = e.exp_category_id")
                .where("e.fiscal_year_id", fiscalYearId)
                .where("e.status", Expense.STATUS_APPROVED)
                .groupBy("ec.exp_category_id", "ec.category_name")
                .orderBy("ec.category_name");
        List<IncomeStatement.Line> expenses = toLines(orm.select(expenseQuery));

        BigDecimal totalIncome = sum(income);
        BigDecimal totalExpenses = sum(expenses);
        return new IncomeStatement(fiscalYearId, income, expenses, totalIncome, totalExpenses,
                totalIncome.subtract(totalExpenses));
    }

    @Override
    public BudgetVsActual getBudgetVsActual(Long fiscalYearId) {
        requireFiscalYear(fiscalYearId);

        QueryBuilder query = QueryBuilder.from("budget", "bu")
                .select("bu.exp_category_id", "ec.category_name",
                        "SUM(bu.budget_amount) AS budget_amount",
                        "(SELECT COALESCE(SUM(e.amount), 0) FROM expense e WHERE e.exp_category_id = bu.exp_category_id"
                                + " AND e.fiscal_year_id = bu.fiscal_year_id AND e.status = 'Approved') AS actual_amount",
                        "(SELECT COUNT(*) FROM expense e WHERE e.exp_category_id = bu.exp_category_id"
                                + " AND e.fiscal_year_id = bu.fiscal_year_id AND e.status = 'Approved') AS expense_count")
                .join("expensecategory", "ec", "ec.exp_category_id = bu.exp_category_id")
                .where("bu.fiscal_year_id", fiscalYearId)
                .groupBy("bu.exp_category_id", "ec.category_name", "bu.fiscal_year_id")
                .orderBy("ec.category_name");
        List<BudgetVsActual.Line> lines = orm.select(query, BudgetVsActual.Line.class);

        BigDecimal totalBudget = BigDecimal.ZERO;
        BigDecimal totalActual = BigDecimal.ZERO;
        for (BudgetVsActual.Line line : lines) {
            BigDecimal budget = nullToZero(line.getBudgetAmount());
            BigDecimal actual = nullToZero(line.getActualAmount());
            line.setBudgetAmount(budget);
            line.setActualAmount(actual);
            line.setVariance(budget.subtract(actual));
            totalBudget = totalBudget.add(budget);
            totalActual = totalActual.add(actual);
        }
        return new BudgetVsActual(fiscalYearId, lines, totalBudget, totalActual, totalBudget.subtract(totalActual));
    }

    private void requireFiscalYear(Long fiscalYearId) {
        if (!fiscalYearRepository.existsById(fiscalYearId)) {
            throw new ResourceNotFoundException("Fiscal year not found");
        }
    }

    private static List<IncomeStatement.Line> toLines(List<Map<String, Object>> rows) {
        return rows.stream()
                .map(row -> new IncomeStatement.Line(
                        ((Number) row.get("id")).longValue(),
                        (String) row.get("name"),
                        toDecimal(row.get("total"))))
                .collect(Collectors.toList());
    }

    private static BigDecimal sum(List<IncomeStatement.Line> lines) {
        return lines.stream().map(IncomeStatement.Line::getTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal toDecimal(Object value) {
        return value == null ? BigDecimal.ZERO : new BigDecimal(value.toString());
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
