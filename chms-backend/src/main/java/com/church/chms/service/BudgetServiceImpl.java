package com.church.chms.service;

import com.church.chms.dto.BudgetCreateRequest;
import com.church.chms.dto.BudgetReviewRequest;
import com.church.chms.dto.BudgetUpdateRequest;
import com.church.chms.dto.BudgetView;
import com.church.chms.entity.Budget;
import com.church.chms.entity.FiscalYear;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.BranchRepository;
import com.church.chms.repository.BudgetRepository;
import com.church.chms.repository.ExpenseCategoryRepository;
import com.church.chms.repository.FiscalYearRepository;
import com.church.chms.security.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@Transactional(readOnly = true)
public class BudgetServiceImpl implements BudgetService {

    private static final String ENTITY = "budget";

    private final BudgetRepository budgetRepository;
    private final FiscalYearRepository fiscalYearRepository;
    private final ExpenseCategoryRepository categoryRepository;
    private final BranchRepository branchRepository;
    private final OrmTemplate orm;
    private final AuditLogService auditLogService;
    private final RequestContext requestContext;
    private final Clock clock;

    public BudgetServiceImpl(BudgetRepository budgetRepository,
                             FiscalYearRepository fiscalYearRepository,
                             ExpenseCategoryRepository categoryRepository,
                             BranchRepository branchRepository,
                             OrmTemplate orm,
                             AuditLogService auditLogService,
                             RequestContext requestContext,
                             Clock clock) {
        this.budgetRepository = budgetRepository;
        this.fiscalYearRepository = fiscalYearRepository;
        this.categoryRepository = categoryRepository;
        this.branchRepository = branchRepository;
        this.orm = orm;
        this.auditLogService = auditLogService;
        this.requestContext = requestContext;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long create(BudgetCreateRequest request) {
        requirePositive(request.getAmount());
        FiscalYear fiscalYear = fiscalYearRepository.findById(request.getFiscalYearId())
                .orElseThrow(() -> new BadRequestException("Invalid fiscal year"));
        if (!FiscalYear.STATUS_ACTIVE.equals(fiscalYear.getStatus())) {
            throw new BadRequestException("Selected fiscal year is not active");
        }
        if (!categoryRepository.existsById(request.getCategoryId())) {
            throw new BadRequestException("Invalid expense category");
        }
        if (!branchRepository.existsById(request.getBranchId())) {
            throw new BadRequestException("Invalid branch ID");
        }

        Budget budget = new Budget();
        budget.setFiscalYearId(request.getFiscalYearId());
        budget.setExpCategoryId(request.getCategoryId());
        budget.setBranchId(request.getBranchId());
        budget.setBudgetAmount(request.getAmount());
        budget.setStatus(Budget.STATUS_DRAFT);
        budget.setRemarks(request.getRemarks());
        budget.setCreatedBy(requestContext.currentMemberId().orElse(null));
        budget.setCreatedAt(LocalDateTime.now(clock));
        Long budgetId = budgetRepository.save(budget).getBudgetId();

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("fiscal_year_id", request.getFiscalYearId());
        changes.put("exp_category_id", request.getCategoryId());
        changes.put("budget_amount", request.getAmount());
        auditLogService.logFinancial("create", ENTITY, budgetId, changes);
        log.info("预算创建成功: budgetId={}, amount={}", budgetId, request.getAmount());
        return budgetId;
    }

    @Override
    @Transactional
    public void update(Long budgetId, BudgetUpdateRequest request) {
        requirePositive(request.getAmount());
        Budget budget = findBudget(budgetId);
        if (Budget.STATUS_APPROVED.equals(budget.getStatus())) {
            throw new BadRequestException("Cannot modify approved budget");
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("old_amount", budget.getBudgetAmount());
        changes.put("new_amount", request.getAmount());
        budget.setBudgetAmount(request.getAmount());
        if (request.getStatus() != null) {
            changes.put("status", request.getStatus());
            budget.setStatus(request.getStatus());
        }
        budgetRepository.save(budget);
        auditLogService.logFinancial("update", ENTITY, budgetId, changes);
    }

    @Override
    @Transactional
    public void delete(Long budgetId) {
        Budget budget = findBudget(budgetId);
        if (Budget.STATUS_APPROVED.equals(budget.getStatus())) {
            throw new BadRequestException("Cannot delete approved budget");
        }
        budgetRepository.delete(budget);
        auditLogService.logFinancial("delete", ENTITY, budgetId, Map.of("budget_amount", budget.getBudgetAmount()));
    }

    @Override
    public BudgetView get(Long budgetId) {
        BudgetView view = orm.selectOne(baseQuery().where("bu.budget_id", budgetId), BudgetView.class);
        if (view == null) {
            throw new ResourceNotFoundException("Budget not found");
        }
        return view;
    }

    @Override
    public PageResult<BudgetView> getAll(int page, int limit, Long fiscalYearId, Long branchId, String status) {
        QueryBuilder query = baseQuery()
                .whereIfPresent("bu.fiscal_year_id", fiscalYearId)
                .whereIfPresent("bu.branch_id", branchId)
                .whereIfPresent("bu.status", status)
                .orderBy("bu.created_at", "DESC")
                .orderBy("bu.budget_id", "DESC");
        return orm.paginate(query, page, limit, BudgetView.class);
    }

    @Override
    @Transactional
    public void submit(Long budgetId) {
        Budget budget = findBudget(budgetId);
        if (!Budget.STATUS_DRAFT.equals(budget.getStatus()) && !Budget.STATUS_REJECTED.equals(budget.getStatus())) {
            throw new BadRequestException("Only draft or rejected budgets can be submitted");
        }
        budget.setStatus(Budget.STATUS_SUBMITTED);
        budgetRepository.save(budget);
        auditLogService.logFinancial("submit", ENTITY, budgetId, Map.of("status", Budget.STATUS_SUBMITTED));
    }

    @Override
    @Transactional
    public void review(Long budgetId, BudgetReviewRequest request) {
        Budget budget = findBudget(budgetId);
        if (!Budget.STATUS_SUBMITTED.equals(budget.getStatus())) {
            throw new BadRequestException("Only submitted budgets can be reviewed");
        }
        boolean approve = "approve".equals(request.getAction());
        budget.setStatus(approve ? Budget.STATUS_APPROVED : Budget.STATUS_REJECTED);
        budget.setRemarks(request.getRemarks());
        budget.setReviewedBy(requestContext.currentMemberId().orElse(null));
        budget.setReviewedAt(LocalDateTime.now(clock));
        budgetRepository.save(budget);

        auditLogService.logApproval(ENTITY, budgetId, approve ? "approve" : "reject", request.getRemarks());
        log.info("预算审批完成: budgetId={}, status={}", budgetId, budget.getStatus());
    }

    private Budget findBudget(Long budgetId) {
        return budgetRepository.findById(budgetId)
                .orElseThrow(() -> new ResourceNotFoundException("Budget not found"));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BadRequestException("Budget amount must be positive");
        }
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("budget", "bu")
                .select("bu.budget_id", "bu.fiscal_year_id", "fy.start_date AS fiscal_year_start",
                        "fy.end_date AS fiscal_year_end", "bu.exp_category_id", "ec.category_name",
                        "bu.branch_id", "b.branch_name", "bu.budget_amount", "bu.status", "bu.remarks",
                        "bu.created_at", "bu.reviewed_at")
                .leftJoin("fiscalyear", "fy", "fy.fiscal_year_id = bu.fiscal_year_id")
                .leftJoin("expensecategory", "ec", "ec.exp_category_id = bu.exp_category_id")
                .leftJoin("branch", "b", "b.branch_id = bu.branch_id");
    }
}
