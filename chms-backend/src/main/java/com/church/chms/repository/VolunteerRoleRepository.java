package com.church.chms.repository;

import com.church.chms.entity.VolunteerRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VolunteerRoleRepository extends JpaRepository<VolunteerRole, Long> {

    boolean existsByRoleName(String roleName);

    List<VolunteerRole> findAllByOrderByRoleNameAsc();
}
