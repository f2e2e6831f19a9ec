package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "family_member")
public class FamilyMember {

    public static final String ROLE_HEAD = "Head";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "family_member_id")
    private Long familyMemberId;

    @Column(name = "family_id", nullable = false)
    private Long familyId;

    @Column(name = "mbr_id", nullable = false)
    private Long mbrId;

    // Head / Spouse / Child / Other
    @Column(name = "family_role", nullable = false, length = 10)
    private String familyRole;

    @Column(name = "joined_at")
    private LocalDateTime joinedAt;
}
