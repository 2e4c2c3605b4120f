package com.kernelworx.fundraiserservice.mapper;

import com.kernelworx.fundraiserservice.dto.AccountResponse;
import com.kernelworx.fundraiserservice.dto.UpdateAccountRequest;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.model.Account;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring"
        , imports = IdCanonicalizer.class
        , unmappedTargetPolicy = ReportingPolicy.IGNORE
        , nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
public interface AccountMapper {

    @Mapping(target = "accountId", expression = "java(IdCanonicalizer.strip(account.getAccountId()))")
    AccountResponse toAccountResponse(Account account);

    /**
     * Copies only the fields present in the request.
     */
    void updateAccountFromRequest(UpdateAccountRequest request, @MappingTarget Account account);
}
