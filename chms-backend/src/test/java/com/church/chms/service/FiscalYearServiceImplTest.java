package com.church.chms.service;

import com.church.chms.dto.FiscalYearRequest;
import com.church.chms.entity.FiscalYear;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.repository.BranchRepository;
import com.church.chms.repository.BudgetRepository;
import com.church.chms.repository.ContributionRepository;
import com.church.chms.repository.ExpenseRepository;
import com.church.chms.repository.FiscalYearRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class FiscalYearServiceImplTest {

    @Mock
    private FiscalYearRepository fiscalYearRepository;

    @Mock
    private BranchRepository branchRepository;

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private ContributionRepository contributionRepository;

    @Mock
    private ExpenseRepository expenseRepository;

    @Mock
    private OrmTemplate orm;

    @Mock
    private AuditLogService auditLogService;

    private FiscalYearServiceImpl fiscalYearService;

    private static final LocalDate START = LocalDate.of(2025, 1, 1);
    private static final LocalDate END = LocalDate.of(2025, 12, 31);

    @BeforeEach
    void setUp() {
        fiscalYearService = new FiscalYearServiceImpl(fiscalYearRepository, branchRepository, budgetRepository,
                contributionRepository, expenseRepository, orm, auditLogService);
    }

    private static FiscalYear year(String status) {
        return new FiscalYear(4L, START, END, 1L, status);
    }

    @Test
    void testCreate_Overlap() {
        when(branchRepository.existsById(1L)).thenReturn(true);
        when(fiscalYearRepository.countOverlapping(1L, FiscalYear.STATUS_ACTIVE, START, END)).thenReturn(1L);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> fiscalYearService.create(new FiscalYearRequest(START, END, 1L, null)));
        assertEquals("Fiscal year overlaps with an existing active fiscal year", ex.getMessage());
    }

    @Test
    void testUpdate_StartNotBeforeEnd() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> fiscalYearService.update(4L, new FiscalYearRequest(END, START, 1L, null)));
        assertEquals("Start date must be before end date", ex.getMessage());
        verifyNoInteractions(fiscalYearRepository);
    }

    @Test
    void testUpdate_NotFound() {
        when(branchRepository.existsById(1L)).thenReturn(true);
        when(fiscalYearRepository.findById(4L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> fiscalYearService.update(4L, new FiscalYearRequest(START, END, 1L, null)));
        assertEquals("Fiscal year not found", ex.getMessage());
    }

    // 重叠检查排除被修改的财年自身
    @Test
    void testUpdate_OverlapExcludesSelf() {
        FiscalYear fiscalYear = year(FiscalYear.STATUS_ACTIVE);
        LocalDate newEnd = LocalDate.of(2026, 3, 31);
        when(branchRepository.existsById(1L)).thenReturn(true);
        when(fiscalYearRepository.findById(4L)).thenReturn(Optional.of(fiscalYear));
        when(fiscalYearRepository.countOverlappingExcluding(1L, FiscalYear.STATUS_ACTIVE, 4L, START, newEnd))
                .thenReturn(0L);

        fiscalYearService.update(4L, new FiscalYearRequest(START, newEnd, 1L, null));

        assertEquals(newEnd, fiscalYear.getEndDate());
        assertEquals(FiscalYear.STATUS_ACTIVE, fiscalYear.getStatus());
        verify(fiscalYearRepository).save(fiscalYear);
        verify(auditLogService).logFinancial(eq("update"), eq("fiscal_year"), eq(4L), anyMap());
    }

    @Test
    void testUpdate_OverlapsAnotherActiveYear() {
        LocalDate newEnd = LocalDate.of(2026, 3, 31);
        when(branchRepository.existsById(1L)).thenReturn(true);
        when(fiscalYearRepository.findById(4L)).thenReturn(Optional.of(year(FiscalYear.STATUS_ACTIVE)));
        when(fiscalYearRepository.countOverlappingExcluding(1L, FiscalYear.STATUS_ACTIVE, 4L, START, newEnd))
                .thenReturn(1L);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> fiscalYearService.update(4L, new FiscalYearRequest(START, newEnd, 1L, null)));
        assertEquals("Fiscal year overlaps with an existing active fiscal year", ex.getMessage());
        verify(fiscalYearRepository, never()).save(any());
    }

    @Test
    void testUpdate_ClosedYearSkipsOverlapCheck() {
        FiscalYear fiscalYear = year(FiscalYear.STATUS_CLOSED);
        when(branchRepository.existsById(1L)).thenReturn(true);
        when(fiscalYearRepository.findById(4L)).thenReturn(Optional.of(fiscalYear));

        fiscalYearService.update(4L, new FiscalYearRequest(START, END, 1L, null));

        verify(fiscalYearRepository, never()).countOverlappingExcluding(any(), any(), any(), any(), any());
        verify(fiscalYearRepository).save(fiscalYear);
    }

    @Test
    void testDelete_ReferencedByContributions() {
        when(fiscalYearRepository.findById(4L)).thenReturn(Optional.of(year(FiscalYear.STATUS_ACTIVE)));
        when(budgetRepository.existsByFiscalYearId(4L)).thenReturn(false);
        when(contributionRepository.existsByFiscalYearId(4L)).thenReturn(true);

        BadRequestException ex = assertThrows(BadRequestException.class, () -> fiscalYearService.delete(4L));
        assertEquals("Cannot delete fiscal year with associated budgets, contributions, or expenses", ex.getMessage());
        verify(fiscalYearRepository, never()).delete(any());
    }

    @Test
    void testDelete_Unreferenced() {
        FiscalYear fiscalYear = year(FiscalYear.STATUS_CLOSED);
        when(fiscalYearRepository.findById(4L)).thenReturn(Optional.of(fiscalYear));
        when(budgetRepository.existsByFiscalYearId(4L)).thenReturn(false);
        when(contributionRepository.existsByFiscalYearId(4L)).thenReturn(false);
        when(expenseRepository.existsByFiscalYearId(4L)).thenReturn(false);

        fiscalYearService.delete(4L);

        verify(fiscalYearRepository).delete(fiscalYear);
    }
}
