package com.kernelworx.fundraiserservice.controller;

import com.kernelworx.fundraiserservice.dto.AccountResponse;
import com.kernelworx.fundraiserservice.dto.UpdateAccountRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentityResolver;
import com.kernelworx.fundraiserservice.service.AccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final CallerIdentityResolver identityResolver;

    // Creates the account on first call
    @GetMapping("/me")
    public ResponseEntity<AccountResponse> getMyAccount(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(accountService.getMyAccount(identityResolver.resolve(jwt)));
    }

    @PatchMapping("/me")
    public ResponseEntity<AccountResponse> updateMyAccount(@Valid @RequestBody UpdateAccountRequest request,
                                                           @AuthenticationPrincipal Jwt jwt) {
        AccountResponse updated = accountService.updateMyAccount(request, identityResolver.resolve(jwt));
        return ResponseEntity.ok(updated);
    }
}
