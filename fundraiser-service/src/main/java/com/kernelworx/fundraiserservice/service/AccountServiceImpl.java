package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.fundraiserservice.dto.AccountResponse;
import com.kernelworx.fundraiserservice.dto.UpdateAccountRequest;
import com.kernelworx.fundraiserservice.mapper.AccountMapper;
import com.kernelworx.fundraiserservice.model.Account;
import com.kernelworx.fundraiserservice.repository.AccountRepository;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.stream.Stream;

@Service
@RequiredArgsConstructor
public class AccountServiceImpl implements AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountServiceImpl.class);

    private final AccountRepository accountRepository;
    private final AccountMapper accountMapper;

    @Override
    @Transactional
    public AccountResponse getMyAccount(CallerIdentity caller) {
        return accountMapper.toAccountResponse(provision(caller));
    }

    @Override
    @Transactional
    public AccountResponse updateMyAccount(UpdateAccountRequest request, CallerIdentity caller) {
        boolean empty = Stream.of(request.getGivenName(), request.getFamilyName(), request.getCity(),
                        request.getState(), request.getUnitType(), request.getUnitNumber())
                .allMatch(value -> value == null);
        if (empty) {
            log.warn("Empty account update from {}", caller.getAccountId());
            throw new BadRequestException("At least one field must be provided");
        }

        Account account = provision(caller);
        accountMapper.updateAccountFromRequest(request, account);
        Account updated = accountRepository.save(account);

        log.info("Account updated: id={}", updated.getAccountId());
        return accountMapper.toAccountResponse(updated);
    }

    @Override
    @Transactional
    public Account provision(CallerIdentity caller) {
        String accountId = caller.getAccountId().getValue();
        return accountRepository.findById(accountId)
                .map(existing -> {
                    // group membership is owned by the identity provider
                    if (!Boolean.valueOf(caller.isAdmin()).equals(existing.getIsAdmin())) {
                        existing.setIsAdmin(caller.isAdmin());
                    }
                    if (existing.getEmail() == null && caller.getEmail() != null) {
                        existing.setEmail(caller.getEmail());
                    }
                    return existing;
                })
                .orElseGet(() -> {
                    Account account = new Account();
                    account.setAccountId(accountId);
                    account.setEmail(caller.getEmail());
                    account.setGivenName(caller.getGivenName());
                    account.setFamilyName(caller.getFamilyName());
                    account.setIsAdmin(caller.isAdmin());
                    Account saved = accountRepository.save(account);
                    log.info("Account created on first sign-in: id={}, admin={}", accountId, caller.isAdmin());
                    return saved;
                });
    }
}
