package com.church.chms.service;

import com.church.chms.entity.ExpenseCategory;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.repository.BudgetRepository;
import com.church.chms.repository.ExpenseCategoryRepository;
import com.church.chms.repository.ExpenseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ExpenseCategoryServiceImplTest {

    @Mock
    private ExpenseCategoryRepository categoryRepository;

    @Mock
    private ExpenseRepository expenseRepository;

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private OrmTemplate orm;

    @Mock
    private AuditLogService auditLogService;

    private ExpenseCategoryServiceImpl categoryService;

    @BeforeEach
    void setUp() {
        categoryService = new ExpenseCategoryServiceImpl(categoryRepository, expenseRepository, budgetRepository,
                orm, auditLogService);
    }

    @Test
    void testCreate_DuplicateName() {
        when(categoryRepository.existsByCategoryName("Utilities")).thenReturn(true);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> categoryService.create(" Utilities "));
        assertEquals("Category name already exists", ex.getMessage());
        verify(categoryRepository, never()).save(any());
    }

    @Test
    void testCreate_Success() {
        when(categoryRepository.existsByCategoryName("Transport")).thenReturn(false);
        when(categoryRepository.save(any(ExpenseCategory.class))).thenReturn(new ExpenseCategory(4L, "Transport"));

        assertEquals(4L, categoryService.create("Transport"));
        verify(auditLogService).logFinancial(eq("create"), eq("expense_category"), eq(4L), anyMap());
    }

    // 改名时不与自身冲突
    @Test
    void testUpdate_ExcludesSelfFromUniqueness() {
        ExpenseCategory category = new ExpenseCategory(1L, "Utilities");
        when(categoryRepository.findById(1L)).thenReturn(Optional.of(category));
        when(categoryRepository.existsByCategoryNameAndExpCategoryIdNot("Utility Bills", 1L)).thenReturn(false);

        categoryService.update(1L, "Utility Bills");

        assertEquals("Utility Bills", category.getCategoryName());
        verify(categoryRepository).save(category);
    }

    @Test
    void testUpdate_NotFound() {
        when(categoryRepository.findById(9L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> categoryService.update(9L, "Anything"));
        assertEquals("Category not found", ex.getMessage());
    }

    @Test
    void testDelete_UsedByExpenses() {
        when(categoryRepository.findById(1L)).thenReturn(Optional.of(new ExpenseCategory(1L, "Utilities")));
        when(expenseRepository.existsByExpCategoryId(1L)).thenReturn(true);

        BadRequestException ex = assertThrows(BadRequestException.class, () -> categoryService.delete(1L));
        assertEquals("Cannot delete category used in expenses", ex.getMessage());
        verify(categoryRepository, never()).delete(any());
    }

    @Test
    void testDelete_Unused() {
        ExpenseCategory category = new ExpenseCategory(2L, "Outreach");
        when(categoryRepository.findById(2L)).thenReturn(Optional.of(category));
        when(expenseRepository.existsByExpCategoryId(2L)).thenReturn(false);
        when(budgetRepository.existsByExpCategoryId(2L)).thenReturn(false);

        categoryService.delete(2L);

        verify(categoryRepository).delete(category);
    }
}
