package com.responseready.apigateway.auth.repository;

import com.responseready.apigateway.auth.domain.AccountActivityEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountActivityRepository extends JpaRepository<AccountActivityEntity, Long> {}
