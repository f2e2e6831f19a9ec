package com.church.chms.repository;

import com.church.chms.entity.CommunicationDelivery;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.data.domain.Pageable;

import java.util.List;

@Repository
public interface CommunicationDeliveryRepository extends JpaRepository<CommunicationDelivery, Long> {

    List<CommunicationDelivery> findByStatusOrderByDeliveryIdAsc(String status, Pageable pageable);

    long countByCommunicationId(Long communicationId);
}
