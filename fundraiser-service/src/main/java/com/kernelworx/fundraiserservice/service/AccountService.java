package com.kernelworx.fundraiserservice.service;

import com.kernelworx.fundraiserservice.dto.AccountResponse;
import com.kernelworx.fundraiserservice.dto.UpdateAccountRequest;
import com.kernelworx.fundraiserservice.model.Account;
import com.kernelworx.fundraiserservice.security.CallerIdentity;

public interface AccountService {

    AccountResponse getMyAccount(CallerIdentity caller);

    AccountResponse updateMyAccount(UpdateAccountRequest request, CallerIdentity caller);

    /**
     * Returns the caller's account, creating it on first sign-in.
     */
    Account provision(CallerIdentity caller);
}
