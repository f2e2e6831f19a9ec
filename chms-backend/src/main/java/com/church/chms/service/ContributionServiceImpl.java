package com.church.chms.service;

import com.church.chms.dto.ContributionFilter;
import com.church.chms.dto.ContributionRequest;
import com.church.chms.dto.ContributionTotal;
import com.church.chms.dto.ContributionUpdateRequest;
import com.church.chms.dto.ContributionView;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.Contribution;
import com.church.chms.entity.FiscalYear;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.ContributionRepository;
import com.church.chms.repository.ContributionTypeRepository;
import com.church.chms.repository.FiscalYearRepository;
import com.church.chms.repository.PaymentOptionRepository;
import com.church.chms.security.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@Transactional(readOnly = true)
public class ContributionServiceImpl implements ContributionService {

    private static final String ENTITY = "contribution";

    private final ContributionRepository contributionRepository;
    private final ContributionTypeRepository typeRepository;
    private final PaymentOptionRepository paymentOptionRepository;
    private final FiscalYearRepository fiscalYearRepository;
    private final ChurchMemberRepository memberRepository;
    private final OrmTemplate orm;
    private final AuditLogService auditLogService;
    private final RequestContext requestContext;
    private final Clock clock;

    public ContributionServiceImpl(ContributionRepository contributionRepository,
                                   ContributionTypeRepository typeRepository,
                                   PaymentOptionRepository paymentOptionRepository,
                                   FiscalYearRepository fiscalYearRepository,
                                   ChurchMemberRepository memberRepository,
                                   OrmTemplate orm,
                                   AuditLogService auditLogService,
                                   RequestContext requestContext,
                                   Clock clock) {
        this.contributionRepository = contributionRepository;
        this.typeRepository = typeRepository;
        this.paymentOptionRepository = paymentOptionRepository;
        this.fiscalYearRepository = fiscalYearRepository;
        this.memberRepository = memberRepository;
        this.orm = orm;
        this.auditLogService = auditLogService;
        this.requestContext = requestContext;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long create(ContributionRequest request) {
        requirePositive(request.getAmount());
        requireNotFuture(request.getContributionDate());
        boolean activeMember = memberRepository.findByMbrIdAndDeletedFalse(request.getMemberId())
                .map(ChurchMember::isActive)
                .orElse(false);
        if (!activeMember) {
            throw new BadRequestException("Invalid or inactive member");
        }
        requireType(request.getContributionTypeId());
        requirePaymentOption(request.getPaymentOptionId());
        FiscalYear fiscalYear = fiscalYearRepository.findById(request.getFiscalYearId())
                .orElseThrow(() -> new BadRequestException("Invalid fiscal year"));
        if (!FiscalYear.STATUS_ACTIVE.equals(fiscalYear.getStatus())) {
            throw new BadRequestException("Selected fiscal year is not active");
        }

        Contribution contribution = new Contribution();
        contribution.setAmount(request.getAmount());
        contribution.setContributionDate(request.getContributionDate());
        contribution.setContributionTypeId(request.getContributionTypeId());
        contribution.setPaymentOptionId(request.getPaymentOptionId());
        contribution.setMbrId(request.getMemberId());
        contribution.setFiscalYearId(request.getFiscalYearId());
        contribution.setDescription(request.getDescription());
        contribution.setDeleted(false);
        contribution.setRecordedBy(requestContext.currentMemberId().orElse(null));
        contribution.setRecordedAt(LocalDateTime.now(clock));
        Long id = contributionRepository.save(contribution).getContributionId();

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("amount", request.getAmount());
        changes.put("mbr_id", request.getMemberId());
        changes.put("contribution_type_id", request.getContributionTypeId());
        auditLogService.logFinancial("create", ENTITY, id, changes);
        log.info("奉献记录创建成功: contributionId={}, amount={}", id, request.getAmount());
        return id;
    }

    @Override
    @Transactional
    public void update(Long contributionId, ContributionUpdateRequest request) {
        Contribution contribution = contributionRepository.findByContributionIdAndDeletedFalse(contributionId)
                .orElseThrow(() -> new ResourceNotFoundException("Contribution not found or deleted"));
        Map<String, Object> changes = new LinkedHashMap<>();

        if (request.getAmount() != null) {
            requirePositive(request.getAmount());
            contribution.setAmount(request.getAmount());
            changes.put("amount", request.getAmount());
        }
        if (request.getContributionDate() != null) {
            requireNotFuture(request.getContributionDate());
            contribution.setContributionDate(request.getContributionDate());
            changes.put("contribution_date", request.getContributionDate().toString());
        }
        if (request.getContributionTypeId() != null) {
            requireType(request.getContributionTypeId());
            contribution.setContributionTypeId(request.getContributionTypeId());
            changes.put("contribution_type_id", request.getContributionTypeId());
        }
        if (request.getPaymentOptionId() != null) {
            requirePaymentOption(request.getPaymentOptionId());
            contribution.setPaymentOptionId(request.getPaymentOptionId());
            changes.put("payment_option_id", request.getPaymentOptionId());
        }
        if (request.getDescription() != null) {
            contribution.setDescription(request.getDescription());
            changes.put("description", request.getDescription());
        }

        if (changes.isEmpty()) {
            return;
        }
        contributionRepository.save(contribution);
        auditLogService.logFinancial("update", ENTITY, contributionId, changes);
    }

    @Override
    @Transactional
    public void delete(Long contributionId) {
        Contribution contribution = contributionRepository.findByContributionIdAndDeletedFalse(contributionId)
                .orElseThrow(() -> new ResourceNotFoundException("Contribution not found or already deleted"));
        contribution.setDeleted(true);
        contributionRepository.save(contribution);
        auditLogService.logFinancial("delete", ENTITY, contributionId, Map.of("deleted", true));
    }

    @Override
    @Transactional
    public void restore(Long contributionId) {
        Contribution contribution = contributionRepository.findByContributionIdAndDeletedTrue(contributionId)
                .orElseThrow(() -> new ResourceNotFoundException("Contribution not found or not deleted"));
        contribution.setDeleted(false);
        contributionRepository.save(contribution);
        auditLogService.logFinancial("restore", ENTITY, contributionId, Map.of("deleted", false));
    }

    @Override
    public ContributionView get(Long contributionId) {
        ContributionView view = orm.selectOne(baseQuery().where("c.contribution_id", contributionId),
                ContributionView.class);
        if (view == null) {
            throw new ResourceNotFoundException("Contribution not found");
        }
        return view;
    }

    @Override
    public PageResult<ContributionView> getAll(int page, int limit, ContributionFilter filter) {
        QueryBuilder query = applyFilter(baseQuery(), filter)
                .orderBy("c.contribution_date", "DESC")
                .orderBy("c.contribution_id", "DESC");
        return orm.paginate(query, page, limit, ContributionView.class);
    }

    @Override
    public ContributionTotal getTotal(ContributionFilter filter) {
        QueryBuilder query = applyFilter(QueryBuilder.from("contribution", "c")
                .select("COALESCE(SUM(c.amount), 0) AS total")
                .whereRaw("c.deleted = FALSE"), filter);
        List<Map<String, Object>> rows = orm.select(query);
        Object total = rows.isEmpty() ? null : rows.get(0).get("total");
        BigDecimal amount = total == null ? BigDecimal.ZERO : new BigDecimal(total.toString());
        return new ContributionTotal(amount.setScale(2, RoundingMode.HALF_UP).toPlainString());
    }

    private QueryBuilder applyFilter(QueryBuilder query, ContributionFilter filter) {
        if (filter == null) {
            return query;
        }
        return query.whereIfPresent("c.contribution_type_id", filter.getContributionTypeId())
                .whereIfPresent("c.mbr_id", filter.getMemberId())
                .whereIfPresent("c.fiscal_year_id", filter.getFiscalYearId())
                .whereIfPresent("c.contribution_date", ">=", filter.getStartDate())
                .whereIfPresent("c.contribution_date", "<=", filter.getEndDate());
    }

    private void requireType(Long typeId) {
        if (!typeRepository.existsById(typeId)) {
            throw new BadRequestException("Invalid contribution type");
        }
    }

    private void requirePaymentOption(Long optionId) {
        if (!paymentOptionRepository.existsById(optionId)) {
            throw new BadRequestException("Invalid payment option");
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BadRequestException("Contribution amount must be positive");
        }
    }

    private void requireNotFuture(LocalDate date) {
        if (date.isAfter(LocalDate.now(clock))) {
            throw new BadRequestException("Contribution date cannot be in the future");
        }
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("contribution", "c")
                .select("c.contribution_id", "c.amount", "c.contribution_date", "c.contribution_type_id",
                        "ct.type_name", "c.payment_option_id", "po.option_name", "c.mbr_id",
                        "CONCAT(m.first_name, ' ', m.family_name) AS member_name", "c.fiscal_year_id",
                        "c.description", "c.recorded_by", "c.recorded_at")
                .leftJoin("contributiontype", "ct", "ct.contribution_type_id = c.contribution_type_id")
                .leftJoin("paymentoption", "po", "po.payment_option_id = c.payment_option_id")
                .leftJoin("churchmember", "m", "m.mbr_id = c.mbr_id")
                .whereRaw("c.deleted = FALSE");
    }
}
