package com.church.chms.service;

import com.church.chms.dto.ContributionFilter;
import com.church.chms.dto.ContributionRequest;
import com.church.chms.dto.ContributionTotal;
import com.church.chms.dto.ContributionUpdateRequest;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.Contribution;
import com.church.chms.entity.FiscalYear;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.ContributionRepository;
import com.church.chms.repository.ContributionTypeRepository;
import com.church.chms.repository.FiscalYearRepository;
import com.church.chms.repository.PaymentOptionRepository;
import com.church.chms.security.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ContributionServiceImplTest {

    @Mock
    private ContributionRepository contributionRepository;

    @Mock
    private ContributionTypeRepository typeRepository;

    @Mock
    private PaymentOptionRepository paymentOptionRepository;

    @Mock
    private FiscalYearRepository fiscalYearRepository;

    @Mock
    private ChurchMemberRepository memberRepository;

    @Mock
    private OrmTemplate orm;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private RequestContext requestContext;

    private ContributionServiceImpl contributionService;

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        contributionService = new ContributionServiceImpl(contributionRepository, typeRepository,
                paymentOptionRepository, fiscalYearRepository, memberRepository, orm, auditLogService,
                requestContext, clock);
    }

    private static ContributionRequest request(String amount, LocalDate date) {
        return new ContributionRequest(new BigDecimal(amount), date, 1L, 2L, 3L, 1L, "Sunday tithe");
    }

    @Test
    void testCreate_Success() {
        ChurchMember member = new ChurchMember();
        member.setMbrId(3L);
        member.setMembershipStatus(ChurchMember.STATUS_ACTIVE);
        when(memberRepository.findByMbrIdAndDeletedFalse(3L)).thenReturn(Optional.of(member));
        when(typeRepository.existsById(1L)).thenReturn(true);
        when(paymentOptionRepository.existsById(2L)).thenReturn(true);
        when(fiscalYearRepository.findById(1L)).thenReturn(Optional.of(
                new FiscalYear(1L, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 12, 31), 1L, FiscalYear.STATUS_ACTIVE)));
        when(requestContext.currentMemberId()).thenReturn(Optional.of(8L));
        when(contributionRepository.save(any(Contribution.class))).thenAnswer(invocation -> {
            Contribution saved = invocation.getArgument(0);
            saved.setContributionId(15L);
            return saved;
        });

        Long id = contributionService.create(request("150.00", TODAY));

        assertEquals(15L, id);
        ArgumentCaptor<Contribution> captor = ArgumentCaptor.forClass(Contribution.class);
        verify(contributionRepository).save(captor.capture());
        assertEquals(8L, captor.getValue().getRecordedBy());
        assertNotNull(captor.getValue().getRecordedAt());
        assertFalse(captor.getValue().isDeleted());
    }

    // 日期晚于今天
    @Test
    void testCreate_FutureDate() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> contributionService.create(request("150.00", TODAY.plusDays(1))));

        assertEquals("Contribution date cannot be in the future", ex.getMessage());
        verifyNoInteractions(contributionRepository);
    }

    @Test
    void testCreate_NegativeAmount() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> contributionService.create(request("-5", TODAY)));

        assertEquals("Contribution amount must be positive", ex.getMessage());
    }

    @Test
    void testUpdate_DeletedContribution() {
        when(contributionRepository.findByContributionIdAndDeletedFalse(15L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> contributionService.update(15L, new ContributionUpdateRequest()));
        assertEquals("Contribution not found or deleted", ex.getMessage());
    }

    @Test
    void testUpdate_InvalidPaymentOption() {
        Contribution contribution = new Contribution();
        contribution.setContributionId(15L);
        when(contributionRepository.findByContributionIdAndDeletedFalse(15L)).thenReturn(Optional.of(contribution));
        when(paymentOptionRepository.existsById(99L)).thenReturn(false);

        ContributionUpdateRequest request = new ContributionUpdateRequest();
        request.setPaymentOptionId(99L);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> contributionService.update(15L, request));
        assertEquals("Invalid payment option", ex.getMessage());
        verify(contributionRepository, never()).save(any());
    }

    @Test
    void testDeleteThenRestore() {
        Contribution contribution = new Contribution();
        contribution.setContributionId(15L);
        when(contributionRepository.findByContributionIdAndDeletedFalse(15L)).thenReturn(Optional.of(contribution));
        when(contributionRepository.findByContributionIdAndDeletedTrue(15L)).thenReturn(Optional.of(contribution));

        contributionService.delete(15L);
        assertTrue(contribution.isDeleted());

        contributionService.restore(15L);
        assertFalse(contribution.isDeleted());
        verify(contributionRepository, times(2)).save(contribution);
    }

    @Test
    void testRestore_NotDeleted() {
        when(contributionRepository.findByContributionIdAndDeletedTrue(15L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> contributionService.restore(15L));
        assertEquals("Contribution not found or not deleted", ex.getMessage());
    }

    // 合计保留两位小数
    @Test
    void testGetTotal_FormatsTwoDecimals() {
        when(orm.select(any(QueryBuilder.class))).thenReturn(List.of(Map.of("total", new BigDecimal("1234.5"))));

        ContributionTotal total = contributionService.getTotal(new ContributionFilter());

        assertEquals("1234.50", total.getTotal());
    }
}
