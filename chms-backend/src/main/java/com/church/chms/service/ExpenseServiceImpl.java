package com.church.chms.service;

import com.church.chms.dto.ExpenseRequest;
import com.church.chms.dto.ExpenseView;
import com.church.chms.entity.Expense;
import com.church.chms.entity.ExpenseApproval;
import com.church.chms.entity.FiscalYear;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.BranchRepository;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.ExpenseApprovalRepository;
import com.church.chms.repository.ExpenseCategoryRepository;
import com.church.chms.repository.ExpenseRepository;
import com.church.chms.repository.FiscalYearRepository;
import com.church.chms.security.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@Transactional(readOnly = true)
public class ExpenseServiceImpl implements ExpenseService {

    private static final String ENTITY = "expense";

    private final ExpenseRepository expenseRepository;
    private final ExpenseApprovalRepository approvalRepository;
    private final FiscalYearRepository fiscalYearRepository;
    private final ExpenseCategoryRepository categoryRepository;
    private final BranchRepository branchRepository;
    private final ChurchMemberRepository memberRepository;
    private final CommunicationService communicationService;
    private final OrmTemplate orm;
    private final AuditLogService auditLogService;
    private final RequestContext requestContext;
    private final Clock clock;

    public ExpenseServiceImpl(ExpenseRepository expenseRepository,
                              ExpenseApprovalRepository approvalRepository,
                              FiscalYearRepository fiscalYearRepository,
                              ExpenseCategoryRepository categoryRepository,
                              BranchRepository branchRepository,
                              ChurchMemberRepository memberRepository,
                              CommunicationService communicationService,
                              OrmTemplate orm,
                              AuditLogService auditLogService,
                              RequestContext requestContext,
                              Clock clock) {
        this.expenseRepository = expenseRepository;
        this.approvalRepository = approvalRepository;
        this.fiscalYearRepository = fiscalYearRepository;
        this.categoryRepository = categoryRepository;
        this.branchRepository = branchRepository;
        this.memberRepository = memberRepository;
        this.communicationService = communicationService;
        this.orm = orm;
        this.auditLogService = auditLogService;
        this.requestContext = requestContext;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long create(ExpenseRequest request) {
        validate(request);
        Long memberId = request.getMemberId() != null ? request.getMemberId() : requestContext.requireMemberId();
        if (memberRepository.findByMbrIdAndDeletedFalse(memberId).isEmpty()) {
            throw new BadRequestException("Invalid member ID");
        }

        Expense expense = new Expense();
        apply(expense, request);
        expense.setMbrId(memberId);
        expense.setStatus(Expense.STATUS_PENDING);
        expense.setCreatedAt(LocalDateTime.now(clock));
        Long expenseId = expenseRepository.save(expense).getExpenseId();

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("expense_title", request.getTitle());
        changes.put("amount", request.getAmount());
        changes.put("exp_category_id", request.getCategoryId());
        changes.put("fiscal_year_id", request.getFiscalYearId());
        auditLogService.logFinancial("create", ENTITY, expenseId, changes);
        communicationService.notify("New Expense Submitted",
                "Expense '" + request.getTitle() + "' for " + request.getAmount() + " has been submitted for approval.",
                memberId, null, null);
        log.info("支出提交成功: expenseId={}, amount={}", expenseId, request.getAmount());
        return expenseId;
    }

    @Override
    @Transactional
    public void update(Long expenseId, ExpenseRequest request) {
        Expense expense = findExpense(expenseId);
        if (!Expense.STATUS_PENDING.equals(expense.getStatus())) {
            throw new BadRequestException("Cannot update approved or declined expense");
        }
        validate(request);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("old_amount", expense.getAmount());
        changes.put("new_amount", request.getAmount());
        apply(expense, request);
        expenseRepository.save(expense);
        auditLogService.logFinancial("update", ENTITY, expenseId, changes);
    }

    @Override
    @Transactional
    public void delete(Long expenseId) {
        Expense expense = findExpense(expenseId);
        if (!Expense.STATUS_PENDING.equals(expense.getStatus())) {
            throw new BadRequestException("Cannot delete approved or declined expense");
        }
        expenseRepository.delete(expense);
        auditLogService.logFinancial("delete", ENTITY, expenseId, Map.of("amount", expense.getAmount()));
    }

    @Override
    public ExpenseView get(Long expenseId) {
        ExpenseView view = orm.selectOne(baseQuery().where("e.expense_id", expenseId), ExpenseView.class);
        if (view == null) {
            throw new ResourceNotFoundException("Expense not found");
        }
        view.setApprovals(approvalRepository.findByExpenseIdOrderByApprovalDateDesc(expenseId));
        return view;
    }

    @Override
    public PageResult<ExpenseView> getAll(int page, int limit, Long fiscalYearId, Long categoryId, String status) {
        QueryBuilder query = baseQuery()
                .whereIfPresent("e.fiscal_year_id", fiscalYearId)
                .whereIfPresent("e.exp_category_id", categoryId)
                .whereIfPresent("e.status", status)
                .orderBy("e.expense_date", "DESC")
                .orderBy("e.expense_id", "DESC");
        return orm.paginate(query, page, limit, ExpenseView.class);
    }

    @Override
    @Transactional
    public void review(Long expenseId, String status, String comments) {
        if (!Expense.STATUS_APPROVED.equals(status) && !Expense.STATUS_DECLINED.equals(status)) {
            throw new BadRequestException("Invalid approval status");
        }
        Expense expense = findExpense(expenseId);
        if (!Expense.STATUS_PENDING.equals(expense.getStatus())) {
            throw new BadRequestException("Expense is already processed");
        }

        Long approverId = requestContext.currentMemberId().orElse(null);
        expense.setStatus(status);
        expenseRepository.save(expense);
        approvalRepository.save(new ExpenseApproval(null, expenseId, approverId, status,
                LocalDateTime.now(clock), comments));

        String message = "Your expense '" + expense.getExpenseTitle() + "' for " + expense.getAmount()
                + " has been " + status + ".";
        if (comments != null && !comments.isBlank()) {
            message += " Comments: " + comments;
        }
        communicationService.notify("Expense " + status, message, approverId, null, expense.getMbrId());
        auditLogService.logApproval(ENTITY, expenseId, status, comments);
        log.info("支出审批完成: expenseId={}, status={}", expenseId, status);
    }

    @Override
    public List<Map<String, Object>> getReport(String type, Long fiscalYearId, Integer year) {
        if (REPORT_BY_CATEGORY.equals(type)) {
            QueryBuilder query = QueryBuilder.from("expense", "e")
                    .select("ec.exp_category_id", "ec.category_name",
                            "SUM(e.amount) AS total_amount", "COUNT(*) AS expense_count")
                    .join("expensecategory", "ec", "ec.exp_category_id = e.exp_category_id")
                    .where("e.status", Expense.STATUS_APPROVED)
                    .whereIfPresent("e.fiscal_year_id", fiscalYearId)
                    .groupBy("ec.exp_category_id", "ec.category_name")
                    .orderBy("total_amount", "DESC");
            return orm.select(query);
        }
        if (REPORT_BY_FISCAL_YEAR.equals(type)) {
            QueryBuilder query = QueryBuilder.from("expense", "e")
                    .select("fy.fiscal_year_id", "fy.start_date", "fy.end_date",
                            "SUM(e.amount) AS total_amount", "COUNT(*) AS expense_count")
                    .join("fiscalyear", "fy", "fy.fiscal_year_id = e.fiscal_year_id")
                    .where("e.status", Expense.STATUS_APPROVED)
                    .groupBy("fy.fiscal_year_id", "fy.start_date", "fy.end_date")
                    .orderBy("fy.start_date", "DESC");
            return orm.select(query);
        }
        if (REPORT_PENDING_VS_APPROVED.equals(type)) {
            QueryBuilder query = QueryBuilder.from("expense", "e")
                    .select("e.status", "COUNT(*) AS expense_count", "SUM(e.amount) AS total_amount")
                    .whereIfPresent("e.fiscal_year_id", fiscalYearId)
                    .groupBy("e.status")
                    .orderBy("e.status");
            return orm.select(query);
        }
        if (REPORT_BY_MONTH.equals(type)) {
            // 按表达式分组，QueryBuilder 的 groupBy 只接受列名
            Map<String, Object> params = new HashMap<>();
            params.put("status", Expense.STATUS_APPROVED);
            StringBuilder sql = new StringBuilder("SELECT YEAR(e.expense_date) AS expense_year,"
                    + " MONTH(e.expense_date) AS expense_month, SUM(e.amount) AS total_amount,"
                    + " COUNT(*) AS expense_count FROM expense e WHERE e.status = :status");
            if (year != null) {
                sql.append(" AND YEAR(e.expense_date) = :year");
                params.put("year", year);
            }
            sql.append(" GROUP BY YEAR(e.expense_date), MONTH(e.expense_date) ORDER BY expense_year, expense_month");
            return orm.runQuery(sql.toString(), params);
        }
        throw new BadRequestException("Invalid report type");
    }

    private void validate(ExpenseRequest request) {
        requirePositive(request.getAmount());
        FiscalYear fiscalYear = fiscalYearRepository.findById(request.getFiscalYearId())
                .orElseThrow(() -> new BadRequestException("Invalid fiscal year"));
        if (!FiscalYear.STATUS_ACTIVE.equals(fiscalYear.getStatus())) {
            throw new BadRequestException("Selected fiscal year is not active");
        }
        if (!categoryRepository.existsById(request.getCategoryId())) {
            throw new BadRequestException("Invalid expense category");
        }
        if (request.getBranchId() != null && !branchRepository.existsById(request.getBranchId())) {
            throw new BadRequestException("Invalid branch ID");
        }
    }

    private static void apply(Expense expense, ExpenseRequest request) {
        expense.setExpenseTitle(request.getTitle().trim());
        expense.setExpensePurpose(request.getPurpose());
        expense.setAmount(request.getAmount());
        expense.setExpenseDate(request.getExpenseDate());
        expense.setExpCategoryId(request.getCategoryId());
        expense.setFiscalYearId(request.getFiscalYearId());
        expense.setBranchId(request.getBranchId());
    }

    private Expense findExpense(Long expenseId) {
        return expenseRepository.findById(expenseId)
                .orElseThrow(() -> new ResourceNotFoundException("Expense not found"));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BadRequestException("Expense amount must be positive");
        }
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("expense", "e")
                .select("e.expense_id", "e.expense_title", "e.expense_purpose", "e.amount", "e.expense_date",
                        "e.exp_category_id", "ec.category_name", "e.fiscal_year_id", "e.branch_id", "b.branch_name",
                        "e.mbr_id", "CONCAT(m.first_name, ' ', m.family_name) AS requester_name", "e.status",
                        "e.created_at")
                .leftJoin("expensecategory", "ec", "ec.exp_category_id = e.exp_category_id")
                .leftJoin("branch", "b", "b.branch_id = e.branch_id")
                .leftJoin("churchmember", "m", "m.mbr_id = e.mbr_id");
    }
}
