package com.responseready.apigateway.auth.api.mapper;

import com.responseready.apigateway.auth.api.dto.AccountView;
import com.responseready.apigateway.auth.api.dto.CredentialsResponse;
import com.responseready.apigateway.auth.api.dto.UpdateAccountRequest;
import com.responseready.apigateway.auth.domain.AccountEntity;
import com.responseready.apigateway.auth.service.AccountUpdate;
import com.responseready.apigateway.auth.service.IssuedCredentials;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface AccountApiMapper {

  AccountView toView(AccountEntity account);

  List<AccountView> toViews(List<AccountEntity> accounts);

  @Mapping(target = "user", source = "account")
  CredentialsResponse toCredentials(IssuedCredentials credentials);

  AccountUpdate toUpdate(UpdateAccountRequest request);
}
