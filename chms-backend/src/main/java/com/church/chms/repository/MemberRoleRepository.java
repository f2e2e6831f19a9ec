package com.church.chms.repository;

import com.church.chms.entity.MemberRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MemberRoleRepository extends JpaRepository<MemberRole, Long> {

    Optional<MemberRole> findByMbrId(Long mbrId);

    boolean existsByRoleId(Long roleId);
}
