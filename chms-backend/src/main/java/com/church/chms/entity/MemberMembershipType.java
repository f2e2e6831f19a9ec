package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * MemberMembershipType: 会籍类型分配，end_date 为 NULL 表示仍在生效
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "member_membership_type")
public class MemberMembershipType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "assignment_id")
    private Long assignmentId;

    @Column(name = "mbr_id", nullable = false)
    private Long mbrId;

    @Column(name = "membership_type_id", nullable = false)
    private Long membershipTypeId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;
}
