package com.church.chms.repository;

import com.church.chms.entity.FiscalYear;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;

@Repository
public interface FiscalYearRepository extends JpaRepository<FiscalYear, Long> {

    /**
     * 同分堂、与给定区间重叠的 Active 财年数量
     */
    @Query("select count(f) from FiscalYear f where f.branchId = :branchId and f.status = :status "
            + "and f.startDate <= :endDate and f.endDate >= :startDate")
    long countOverlapping(@Param("branchId") Long branchId, @Param("status") String status,
                          @Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);

    /**
     * 同上，但排除正在修改的财年自身
     */
    @Query("select count(f) from FiscalYear f where f.branchId = :branchId and f.status = :status "
            + "and f.fiscalYearId <> :fiscalYearId "
            + "and f.startDate <= :endDate and f.endDate >= :startDate")
    long countOverlappingExcluding(@Param("branchId") Long branchId, @Param("status") String status,
                                   @Param("fiscalYearId") Long fiscalYearId,
                                   @Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);
}
