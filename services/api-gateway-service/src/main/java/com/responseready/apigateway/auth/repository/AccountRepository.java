package com.responseready.apigateway.auth.repository;

import com.responseready.apigateway.auth.domain.AccountEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

  Optional<AccountEntity> findByUsername(String username);

  Optional<AccountEntity> findByUsernameAndActiveTrue(String username);

  boolean existsByUsername(String username);

  List<AccountEntity> findAllByOrderByCreatedAtDesc();
}
