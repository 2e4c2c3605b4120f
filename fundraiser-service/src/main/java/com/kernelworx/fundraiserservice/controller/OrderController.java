package com.kernelworx.fundraiserservice.controller;

import com.kernelworx.fundraiserservice.dto.OrderRequest;
import com.kernelworx.fundraiserservice.dto.OrderResponse;
import com.kernelworx.fundraiserservice.dto.UpdateOrderRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentityResolver;
import com.kernelworx.fundraiserservice.service.OrderService;
import jakarta.validation.Valid;
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
public class OrderController {

    private final OrderService orderService;
    private final CallerIdentityResolver identityResolver;

    @PostMapping("/orders")
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody OrderRequest request,
                                                     @AuthenticationPrincipal Jwt jwt) {
        OrderResponse created = orderService.createOrder(request, identityResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String orderId, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.of(orderService.getOrder(orderId, identityResolver.resolve(jwt)));
    }

    @GetMapping("/campaigns/{campaignId}/orders")
    public ResponseEntity<List<OrderResponse>> listByCampaign(@PathVariable String campaignId,
                                                              @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.listOrdersByCampaign(campaignId, identityResolver.resolve(jwt)));
    }

    @GetMapping("/profiles/{profileId}/orders")
    public ResponseEntity<List<OrderResponse>> listByProfile(@PathVariable String profileId,
                                                             @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.listOrdersByProfile(profileId, identityResolver.resolve(jwt)));
    }

    @PatchMapping("/orders/{orderId}")
    public ResponseEntity<OrderResponse> updateOrder(@PathVariable String orderId,
                                                     @Valid @RequestBody UpdateOrderRequest request,
                                                     @AuthenticationPrincipal Jwt jwt) {
        OrderResponse updated = orderService.updateOrder(orderId, request, identityResolver.resolve(jwt));
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/orders/{orderId}")
    public ResponseEntity<Void> deleteOrder(@PathVariable String orderId, @AuthenticationPrincipal Jwt jwt) {
        orderService.deleteOrder(orderId, identityResolver.resolve(jwt));
        return ResponseEntity.noContent().build();
    }
}
