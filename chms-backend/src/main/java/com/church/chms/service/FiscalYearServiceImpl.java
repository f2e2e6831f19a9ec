package com.church.chms.service;

import com.church.chms.dto.FiscalYearRequest;
import com.church.chms.dto.FiscalYearView;
import com.church.chms.entity.FiscalYear;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.BranchRepository;
import com.church.chms.repository.BudgetRepository;
import com.church.chms.repository.ContributionRepository;
import com.church.chms.repository.ExpenseRepository;
import com.church.chms.repository.FiscalYearRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@Transactional(readOnly = true)
public class FiscalYearServiceImpl implements FiscalYearService {

    private static final String ENTITY = "fiscal_year";

    private final FiscalYearRepository fiscalYearRepository;
    private final BranchRepository branchRepository;
    private final BudgetRepository budgetRepository;
    private final ContributionRepository contributionRepository;
    private final ExpenseRepository expenseRepository;
    private final OrmTemplate orm;
    private final AuditLogService auditLogService;

    public FiscalYearServiceImpl(FiscalYearRepository fiscalYearRepository,
                                 BranchRepository branchRepository,
                                 BudgetRepository budgetRepository,
                                 ContributionRepository contributionRepository,
                                 ExpenseRepository expenseRepository,
                                 OrmTemplate orm,
                                 AuditLogService auditLogService) {
        this.fiscalYearRepository = fiscalYearRepository;
        this.branchRepository = branchRepository;
        this.budgetRepository = budgetRepository;
        this.contributionRepository = contributionRepository;
        this.expenseRepository = expenseRepository;
        this.orm = orm;
        this.auditLogService = auditLogService;
    }

    @Override
    @Transactional
    public Long create(FiscalYearRequest request) {
        if (!request.getStartDate().isBefore(request.getEndDate())) {
            throw new BadRequestException("Start date must be before end date");
        }
        if (!branchRepository.existsById(request.getBranchId())) {
            throw new BadRequestException("Invalid branch ID");
        }
        String status = request.getStatus() == null ? FiscalYear.STATUS_ACTIVE : request.getStatus();
        if (FiscalYear.STATUS_ACTIVE.equals(status)
                && fiscalYearRepository.countOverlapping(request.getBranchId(), FiscalYear.STATUS_ACTIVE,
                request.getStartDate(), request.getEndDate()) > 0) {
            throw new BadRequestException("Fiscal year overlaps with an existing active fiscal year");
        }

        FiscalYear fiscalYear = new FiscalYear(null, request.getStartDate(), request.getEndDate(),
                request.getBranchId(), status);
        Long id = fiscalYearRepository.save(fiscalYear).getFiscalYearId();

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("start_date", request.getStartDate().toString());
        changes.put("end_date", request.getEndDate().toString());
        changes.put("branch_id", request.getBranchId());
        auditLogService.logFinancial("create", ENTITY, id, changes);
        return id;
    }

    @Override
    @Transactional
    public void update(Long fiscalYearId, FiscalYearRequest request) {
        if (!request.getStartDate().isBefore(request.getEndDate())) {
            throw new BadRequestException("Start date must be before end date");
        }
        if (!branchRepository.existsById(request.getBranchId())) {
            throw new BadRequestException("Invalid branch ID");
        }
        FiscalYear fiscalYear = findFiscalYear(fiscalYearId);
        String status = request.getStatus() == null ? fiscalYear.getStatus() : request.getStatus();
        if (FiscalYear.STATUS_ACTIVE.equals(status)
                && fiscalYearRepository.countOverlappingExcluding(request.getBranchId(), FiscalYear.STATUS_ACTIVE,
                fiscalYearId, request.getStartDate(), request.getEndDate()) > 0) {
            throw new BadRequestException("Fiscal year overlaps with an existing active fiscal year");
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("old_start_date", fiscalYear.getStartDate().toString());
        changes.put("old_end_date", fiscalYear.getEndDate().toString());
        changes.put("start_date", request.getStartDate().toString());
        changes.put("end_date", request.getEndDate().toString());
        changes.put("status", status);
        fiscalYear.setStartDate(request.getStartDate());
        fiscalYear.setEndDate(request.getEndDate());
        fiscalYear.setBranchId(request.getBranchId());
        fiscalYear.setStatus(status);
        fiscalYearRepository.save(fiscalYear);
        auditLogService.logFinancial("update", ENTITY, fiscalYearId, changes);
    }

    @Override
    @Transactional
    public void delete(Long fiscalYearId) {
        FiscalYear fiscalYear = findFiscalYear(fiscalYearId);
        if (budgetRepository.existsByFiscalYearId(fiscalYearId)
                || contributionRepository.existsByFiscalYearId(fiscalYearId)
                || expenseRepository.existsByFiscalYearId(fiscalYearId)) {
            throw new BadRequestException("Cannot delete fiscal year with associated budgets, contributions, or expenses");
        }
        fiscalYearRepository.delete(fiscalYear);
        auditLogService.logFinancial("delete", ENTITY, fiscalYearId,
                Map.of("start_date", fiscalYear.getStartDate().toString(), "end_date", fiscalYear.getEndDate().toString()));
        log.info("财年已删除: fiscalYearId={}", fiscalYearId);
    }

    @Override
    @Transactional
    public void close(Long fiscalYearId) {
        FiscalYear fiscalYear = findFiscalYear(fiscalYearId);
        if (FiscalYear.STATUS_CLOSED.equals(fiscalYear.getStatus())) {
            throw new BadRequestException("Fiscal year is already closed");
        }
        fiscalYear.setStatus(FiscalYear.STATUS_CLOSED);
        fiscalYearRepository.save(fiscalYear);
        auditLogService.logFinancial("close", ENTITY, fiscalYearId, Map.of("status", FiscalYear.STATUS_CLOSED));
    }

    @Override
    public FiscalYearView get(Long fiscalYearId) {
        FiscalYearView view = orm.selectOne(baseQuery().where("fy.fiscal_year_id", fiscalYearId), FiscalYearView.class);
        if (view == null) {
            throw new ResourceNotFoundException("Fiscal year not found");
        }
        return view;
    }

    @Override
    public PageResult<FiscalYearView> getAll(int page, int limit, Long branchId, String status) {
        QueryBuilder query = baseQuery()
                .whereIfPresent("fy.branch_id", branchId)
                .whereIfPresent("fy.status", status)
                .orderBy("fy.start_date", "DESC");
        return orm.paginate(query, page, limit, FiscalYearView.class);
    }

    private FiscalYear findFiscalYear(Long fiscalYearId) {
        return fiscalYearRepository.findById(fiscalYearId)
                .orElseThrow(() -> new ResourceNotFoundException("Fiscal year not found"));
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("fiscalyear", "fy")
                .select("fy.fiscal_year_id", "fy.start_date", "fy.end_date", "fy.branch_id",
                        "b.branch_name", "fy.status")
                .leftJoin("branch", "b", "b.branch_id = fy.branch_id");
    }
}
