package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MemberRole: 成员 → 角色，每个成员只有一个角色
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "memberrole")
public class MemberRole {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "member_role_id")
    private Long memberRoleId;

    @Column(name = "mbr_id", nullable = false, unique = true)
    private Long mbrId;

    @Column(name = "role_id", nullable = false)
    private Long roleId;
}
