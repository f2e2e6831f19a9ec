package com.church.chms.repository;

import com.church.chms.entity.MemberPhone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

@Repository
public interface MemberPhoneRepository extends JpaRepository<MemberPhone, Long> {

    List<MemberPhone> findByMbrIdOrderByPrimaryPhoneDescMemberPhoneIdAsc(Long mbrId);

    Optional<MemberPhone> findFirstByMbrIdAndPrimaryPhoneTrue(Long mbrId);

    boolean existsByPhoneNumber(String phoneNumber);

    boolean existsByPhoneNumberAndMemberPhoneIdNot(String phoneNumber, Long memberPhoneId);

    long countByMbrId(Long mbrId);

    // 清除成员的主号码标记
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update MemberPhone p set p.primaryPhone = false where p.mbrId = :mbrId")
    int clearPrimary(@Param("mbrId") Long mbrId);

    void deleteByMbrId(Long mbrId);
}
