package com.church.chms.dto;

import com.church.chms.entity.MemberPhone;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * 成员视图，householdName 为所属家庭名称
 */
@Data
@NoArgsConstructor
public class MemberView {

    private Long mbrId;
    private String firstName;
    private String familyName;
    private String otherNames;
    private String gender;
    private String emailAddress;
    private String residentialAddress;
    private LocalDate dateOfBirth;
    private String occupation;
    private LocalDate registrationDate;
    private String membershipStatus;
    private Long branchId;
    private String branchName;
    private Long familyId;
    private String householdName;

    // 仅单个成员详情时填充
    private List<MemberPhone> phones;
}
