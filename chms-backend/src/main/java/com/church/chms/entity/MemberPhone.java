package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MemberPhone: 成员电话，号码全局唯一，每个成员最多一个主号码
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "member_phone")
public class MemberPhone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "member_phone_id")
    private Long memberPhoneId;

    @Column(name = "mbr_id", nullable = false)
    private Long mbrId;

    @Column(name = "phone_number", nullable = false, unique = true, length = 20)
    private String phoneNumber;

    // Mobile / Home / Work / Other
    @Column(name = "phone_type", nullable = false, length = 10)
    private String phoneType;

    @Column(name = "is_primary", nullable = false)
    private boolean primaryPhone;
}
