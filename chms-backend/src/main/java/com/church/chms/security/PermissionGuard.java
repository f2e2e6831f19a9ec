package com.church.chms.security;

import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.QueryBuilder;
import org.springframework.stereotype.Component;

/**
 * 权限判定：成员 → 角色 → 角色权限 → 权限名
 */
@Component
public class PermissionGuard {

    private final OrmTemplate orm;

    public PermissionGuard(OrmTemplate orm) {
        this.orm = orm;
    }

    public boolean check(Long memberId, String permission) {
        if (memberId == null || permission == null) {
            return false;
        }
        QueryBuilder query = QueryBuilder.from("memberrole", "mr")
                .select("p.permission_id")
                .join("role_permission", "rp", "rp.role_id = mr.role_id")
                .join("permission", "p", "p.permission_id = rp.permission_id")
                .where("mr.mbr_id", memberId)
                .where("p.permission_name", permission);
        return orm.count(query) > 0;
    }
}
