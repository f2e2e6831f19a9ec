package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * CommunicationDelivery: 每个接收人、每个渠道一条投递记录，由定时任务发送
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "communication_delivery")
public class CommunicationDelivery {

    public static final String CHANNEL_IN_APP = "InApp";
    public static final String CHANNEL_EMAIL = "Email";
    public static final String CHANNEL_SMS = "SMS";

    public static final String STATUS_PENDING = "Pending";
    public static final String STATUS_SENT = "Sent";
    public static final String STATUS_FAILED = "Failed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "delivery_id")
    private Long deliveryId;

    @Column(name = "communication_id", nullable = false)
    private Long communicationId;

    @Column(name = "mbr_id", nullable = false)
    private Long mbrId;

    @Column(name = "channel", nullable = false, length = 10)
    private String channel;

    @Column(name = "status", nullable = false, length = 10)
    private String status;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "error_message", length = 500)
    private String errorMessage;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
