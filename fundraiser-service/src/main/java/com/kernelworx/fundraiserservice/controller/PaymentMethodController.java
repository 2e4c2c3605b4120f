package com.kernelworx.fundraiserservice.controller;

import com.kernelworx.fundraiserservice.dto.PaymentMethodRequest;
import com.kernelworx.fundraiserservice.dto.PaymentMethodResponse;
import com.kernelworx.fundraiserservice.security.CallerIdentityResolver;
import com.kernelworx.fundraiserservice.service.PaymentMethodService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PaymentMethodController {

    private final PaymentMethodService paymentMethodService;
    private final CallerIdentityResolver identityResolver;

    @GetMapping("/payment-methods")
    public ResponseEntity<List<PaymentMethodResponse>> getMyPaymentMethods(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(paymentMethodService.myPaymentMethods(identityResolver.resolve(jwt)));
    }

    @GetMapping("/profiles/{profileId}/payment-methods")
    public ResponseEntity<List<PaymentMethodResponse>> getProfilePaymentMethods(@PathVariable String profileId,
                                                                                @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(paymentMethodService.paymentMethodsForProfile(profileId, identityResolver.resolve(jwt)));
    }

    @PostMapping("/payment-methods")
    public ResponseEntity<PaymentMethodResponse> createPaymentMethod(@RequestBody PaymentMethodRequest request,
                                                                     @AuthenticationPrincipal Jwt jwt) {
        PaymentMethodResponse created = paymentMethodService.createPaymentMethod(request.getName(),
                identityResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // Rename
    @PutMapping("/payment-methods/{name}")
    public ResponseEntity<PaymentMethodResponse> updatePaymentMethod(@PathVariable String name,
                                                                     @RequestBody PaymentMethodRequest request,
                                                                     @AuthenticationPrincipal Jwt jwt) {
        PaymentMethodResponse updated = paymentMethodService.updatePaymentMethod(name, request.getName(),
                identityResolver.resolve(jwt));
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/payment-methods/{name}")
    public ResponseEntity<Void> deletePaymentMethod(@PathVariable String name, @AuthenticationPrincipal Jwt jwt) {
        paymentMethodService.deletePaymentMethod(name, identityResolver.resolve(jwt));
        return ResponseEntity.noContent().build();
    }
}
