package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * ChurchMember Entity: 成员基础信息表
 * 对应数据库中的 'churchmember' 表结构，删除为软删除 (deleted = true)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "churchmember")
public class ChurchMember {

    public static final String STATUS_ACTIVE = "Active";
    public static final String STATUS_INACTIVE = "Inactive";

    /**
     * mbr_id: 成员唯一标识符 (Primary Key)
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "mbr_id")
    private Long mbrId;

    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "family_name", nullable = false, length = 50)
    private String familyName;

    @Column(name = "other_names", length = 100)
    private String otherNames;

    /**
     * gender: 默认 Male
     */
    @Column(name = "gender", length = 10)
    private String gender;

    @Column(name = "email_address", length = 100)
    private String emailAddress;

    @Column(name = "residential_address", length = 255)
    private String residentialAddress;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    /**
     * occupation: 默认 "Not Applicable"
     */
    @Column(name = "occupation", length = 100)
    private String occupation;

    @Column(name = "registration_date")
    private LocalDate registrationDate;

    /**
     * membership_status: Active / Inactive
     */
    @Column(name = "membership_status", nullable = false, length = 20)
    private String membershipStatus;

    @Column(name = "branch_id")
    private Long branchId;

    /**
     * family_id: 所属家庭，未加入家庭时为 NULL
     */
    @Column(name = "family_id")
    private Long familyId;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    public boolean isActive() {
        return !deleted && STATUS_ACTIVE.equals(membershipStatus);
    }
}
