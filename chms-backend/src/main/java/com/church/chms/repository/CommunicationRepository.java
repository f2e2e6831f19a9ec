package com.church.chms.repository;

import com.church.chms.entity.Communication;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CommunicationRepository extends JpaRepository<Communication, Long> {

    boolean existsByTargetGroupId(Long targetGroupId);
}
