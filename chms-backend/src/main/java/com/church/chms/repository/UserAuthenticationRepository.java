package com.church.chms.repository;

import com.church.chms.entity.UserAuthentication;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserAuthenticationRepository extends JpaRepository<UserAuthentication, Long> {

    boolean existsByUsername(String username);

    Optional<UserAuthentication> findByUsername(String username);

    Optional<UserAuthentication> findByMbrId(Long mbrId);
}
