package com.church.chms.service;

import com.church.chms.entity.CommunicationDelivery;
import com.church.chms.repository.CommunicationDeliveryRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 逐条落库投递结果，每次调用在独立事务中提交
 */
@Component
public class DeliveryStatusWriter {

    private final CommunicationDeliveryRepository deliveryRepository;

    public DeliveryStatusWriter(CommunicationDeliveryRepository deliveryRepository) {
        this.deliveryRepository = deliveryRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(CommunicationDelivery delivery) {
        deliveryRepository.save(delivery);
    }
}
