package com.church.chms.service;

import com.church.chms.entity.ExpenseCategory;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.BudgetRepository;
import com.church.chms.repository.ExpenseCategoryRepository;
import com.church.chms.repository.ExpenseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

@Slf4j
@Service
@Transactional(readOnly = true)
public class ExpenseCategoryServiceImpl implements ExpenseCategoryService {

    private static final String ENTITY = "expense_category";

    private final ExpenseCategoryRepository categoryRepository;
    private final ExpenseRepository expenseRepository;
    private final BudgetRepository budgetRepository;
    private final OrmTemplate orm;
    private final AuditLogService auditLogService;

    public ExpenseCategoryServiceImpl(ExpenseCategoryRepository categoryRepository,
                                      ExpenseRepository expenseRepository,
                                      BudgetRepository budgetRepository,
                                      OrmTemplate orm,
                                      AuditLogService auditLogService) {
        this.categoryRepository = categoryRepository;
        this.expenseRepository = expenseRepository;
        this.budgetRepository = budgetRepository;
        this.orm = orm;
        this.auditLogService = auditLogService;
    }

    @Override
    @Transactional
    public Long create(String categoryName) {
        String name = categoryName.trim();
        if (categoryRepository.existsByCategoryName(name)) {
            throw new BadRequestException("Category name already exists");
        }
        Long id = categoryRepository.save(new ExpenseCategory(null, name)).getExpCategoryId();
        auditLogService.logFinancial("create", ENTITY, id, Map.of("category_name", name));
        return id;
    }

    @Override
    @Transactional
    public void update(Long categoryId, String categoryName) {
        ExpenseCategory category = findCategory(categoryId);
        String name = categoryName.trim();
        if (categoryRepository.existsByCategoryNameAndExpCategoryIdNot(name, categoryId)) {
            throw new BadRequestException("Category name already exists");
        }
        auditLogService.logFinancial("update", ENTITY, categoryId,
                Map.of("old_name", category.getCategoryName(), "new_name", name));
        category.setCategoryName(name);
        categoryRepository.save(category);
    }

    @Override
    @Transactional
    public void delete(Long categoryId) {
        ExpenseCategory category = findCategory(categoryId);
        if (expenseRepository.existsByExpCategoryId(categoryId) || budgetRepository.existsByExpCategoryId(categoryId)) {
            throw new BadRequestException("Cannot delete category used in expenses");
        }
        categoryRepository.delete(category);
        auditLogService.logFinancial("delete", ENTITY, categoryId, Map.of("category_name", category.getCategoryName()));
        log.info("支出类别已删除: {}", category.getCategoryName());
    }

    @Override
    public ExpenseCategory get(Long categoryId) {
        return findCategory(categoryId);
    }

    @Override
    public PageResult<ExpenseCategory> getAll(int page, int limit, String name) {
        QueryBuilder query = QueryBuilder.from("expensecategory", "ec")
                .select("ec.exp_category_id", "ec.category_name")
                .whereIfPresent("ec.category_name", "LIKE", name == null ? null : "%" + name.trim() + "%")
                .orderBy("ec.category_name");
        return orm.paginate(query, page, limit, ExpenseCategory.class);
    }

    private ExpenseCategory findCategory(Long categoryId) {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));
    }
}
