package com.church.chms.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * ChurchGroup: 小组 (团契、诗班等)，组长必须是在籍成员
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "churchgroup")
public class ChurchGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "group_id")
    private Long groupId;

    @Column(name = "group_name", nullable = false, unique = true, length = 100)
    private String groupName;

    @Column(name = "group_leader_id", nullable = false)
    private Long groupLeaderId;

    @Column(name = "group_type_id", nullable = false)
    private Long groupTypeId;

    @Column(name = "group_description", length = 500)
    private String groupDescription;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
