package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Communication: 通知/消息，目标为某个小组或某个成员 (都为空时是系统通知)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "communication")
public class Communication {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "communication_id")
    private Long communicationId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, length = 2000)
    private String message;

    @Column(name = "sent_by")
    private Long sentBy;

    @Column(name = "target_group_id")
    private Long targetGroupId;

    @Column(name = "target_member_id")
    private Long targetMemberId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
