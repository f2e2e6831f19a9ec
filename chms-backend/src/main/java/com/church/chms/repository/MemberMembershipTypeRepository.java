package com.church.chms.repository;

import com.church.chms.entity.MemberMembershipType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;

@Repository
public interface MemberMembershipTypeRepository extends JpaRepository<MemberMembershipType, Long> {

    boolean existsByMembershipTypeId(Long membershipTypeId);

    boolean existsByMbrIdAndEndDateIsNull(Long mbrId);

    /**
     * 与从 startDate 开始、不设结束日期的新分配相重叠的分配数量
     */
    @Query("select count(a) from MemberMembershipType a where a.mbrId = :mbrId "
            + "and (a.endDate is null or a.endDate >= :startDate)")
    long countOverlapping(@Param("mbrId") Long mbrId, @Param("startDate") LocalDate startDate);

    /**
     * 同一会员的其他分配中，与 [startDate, endDate] 相交的数量
     */
    @Query("select count(a) from MemberMembershipType a where a.mbrId = :mbrId "
            + "and a.assignmentId <> :assignmentId "
            + "and a.startDate <= :endDate "
            + "and (a.endDate is null or a.endDate >= :startDate)")
    long countOverlappingExcluding(@Param("mbrId") Long mbrId,
                                   @Param("assignmentId") Long assignmentId,
                                   @Param("startDate") LocalDate startDate,
                                   @Param("endDate") LocalDate endDate);
}
