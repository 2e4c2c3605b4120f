package com.kernelworx.fundraiserservice.controller;

import com.kernelworx.fundraiserservice.dto.CampaignRequest;
import com.kernelworx.fundraiserservice.dto.CampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateCampaignRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentityResolver;
import com.kernelworx.fundraiserservice.service.CampaignService;
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
public class CampaignController {

    private final CampaignService campaignService;
    private final CallerIdentityResolver identityResolver;

    @PostMapping("/campaigns")
    public ResponseEntity<CampaignResponse> createCampaign(@Valid @RequestBody CampaignRequest request,
                                                           @AuthenticationPrincipal Jwt jwt) {
        CampaignResponse created = campaignService.createCampaign(request, identityResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/campaigns/{campaignId}")
    public ResponseEntity<CampaignResponse> getCampaign(@PathVariable String campaignId,
                                                        @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.of(campaignService.getCampaign(campaignId, identityResolver.resolve(jwt)));
    }

    @GetMapping("/profiles/{profileId}/campaigns")
    public ResponseEntity<List<CampaignResponse>> listCampaigns(@PathVariable String profileId,
                                                                @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(campaignService.listCampaignsByProfile(profileId, identityResolver.resolve(jwt)));
    }

    @PatchMapping("/campaigns/{campaignId}")
    public ResponseEntity<CampaignResponse> updateCampaign(@PathVariable String campaignId,
                                                           @Valid @RequestBody UpdateCampaignRequest request,
                                                           @AuthenticationPrincipal Jwt jwt) {
        CampaignResponse updated = campaignService.updateCampaign(campaignId, request, identityResolver.resolve(jwt));
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/campaigns/{campaignId}")
    public ResponseEntity<Void> deleteCampaign(@PathVariable String campaignId, @AuthenticationPrincipal Jwt jwt) {
        campaignService.deleteCampaign(campaignId, identityResolver.resolve(jwt));
        return ResponseEntity.noContent().build();
    }
}
