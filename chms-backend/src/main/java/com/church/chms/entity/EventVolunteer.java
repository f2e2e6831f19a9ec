package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * EventVolunteer: 活动志愿者分配
 * 状态 Pending → Confirmed / Declined，确认后可标记 Completed。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "event_volunteer",
        uniqueConstraints = @UniqueConstraint(columnNames = {"event_id", "mbr_id"}))
public class EventVolunteer {

    public static final String STATUS_PENDING = "Pending";
    public static final String STATUS_CONFIRMED = "Confirmed";
    public static final String STATUS_DECLINED = "Declined";
    public static final String STATUS_COMPLETED = "Completed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "event_volunteer_id")
    private Long eventVolunteerId;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "mbr_id", nullable = false)
    private Long mbrId;

    @Column(name = "volunteer_role_id")
    private Long volunteerRoleId;

    @Column(name = "assigned_by")
    private Long assignedBy;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "status", nullable = false, length = 10)
    private String status;

    @Column(name = "assigned_at")
    private LocalDateTime assignedAt;

    @Column(name = "responded_at")
    private LocalDateTime respondedAt;
}
