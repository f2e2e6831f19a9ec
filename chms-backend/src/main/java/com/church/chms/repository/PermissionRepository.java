package com.church.chms.repository;

import com.church.chms.entity.Permission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PermissionRepository extends JpaRepository<Permission, Long> {

    boolean existsByPermissionName(String permissionName);

    boolean existsByPermissionNameAndPermissionIdNot(String permissionName, Long permissionId);
}
