package com.church.chms.dto;

import com.church.chms.entity.Role;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
public class PermissionView {

    private Long permissionId;
    private String permissionName;
    private List<Role> roles;
}
