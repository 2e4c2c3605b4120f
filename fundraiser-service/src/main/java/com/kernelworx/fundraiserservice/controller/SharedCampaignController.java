package com.kernelworx.fundraiserservice.controller;

import com.kernelworx.fundraiserservice.dto.SharedCampaignRequest;
import com.kernelworx.fundraiserservice.dto.SharedCampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateSharedCampaignRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentityResolver;
import com.kernelworx.fundraiserservice.service.SharedCampaignService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/shared-campaigns")
@RequiredArgsConstructor
public class SharedCampaignController {

    private final SharedCampaignService sharedCampaignService;
    private final CallerIdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<SharedCampaignResponse> createSharedCampaign(@Valid @RequestBody SharedCampaignRequest request,
                                                                       @AuthenticationPrincipal Jwt jwt) {
        SharedCampaignResponse created = sharedCampaignService.createSharedCampaign(request, identityResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/mine")
    public ResponseEntity<List<SharedCampaignResponse>> getMySharedCampaigns(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(sharedCampaignService.listMySharedCampaigns(identityResolver.resolve(jwt)));
    }

    @GetMapping("/search")
    public ResponseEntity<List<SharedCampaignResponse>> findSharedCampaigns(
            @RequestParam String unitType,
            @RequestParam String unitNumber,
            @RequestParam String city,
            @RequestParam String state,
            @RequestParam String campaignName,
            @RequestParam Integer campaignYear) {
        List<SharedCampaignResponse> found = sharedCampaignService.findSharedCampaigns(unitType, unitNumber, city,
                state, campaignName, campaignYear);
        return ResponseEntity.ok(found);
    }

    @GetMapping("/{code}")
    public ResponseEntity<SharedCampaignResponse> getSharedCampaign(@PathVariable String code) {
        return ResponseEntity.of(sharedCampaignService.getSharedCampaign(code));
    }

    @PatchMapping("/{code}")
    public ResponseEntity<SharedCampaignResponse> updateSharedCampaign(@PathVariable String code,
                                                                       @Valid @RequestBody UpdateSharedCampaignRequest request,
                                                                       @AuthenticationPrincipal Jwt jwt) {
        SharedCampaignResponse updated = sharedCampaignService.updateSharedCampaign(code, request,
                identityResolver.resolve(jwt));
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{code}")
    public ResponseEntity<Void> deleteSharedCampaign(@PathVariable String code, @AuthenticationPrincipal Jwt jwt) {
        sharedCampaignService.deleteSharedCampaign(code, identityResolver.resolve(jwt));
        return ResponseEntity.noContent().build();
    }
}
