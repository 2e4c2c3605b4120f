package com.kernelworx.fundraiserservice.controller;

import com.kernelworx.fundraiserservice.dto.ProfileRequest;
import com.kernelworx.fundraiserservice.dto.ProfileResponse;
import com.kernelworx.fundraiserservice.dto.TransferOwnershipRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentityResolver;
import com.kernelworx.fundraiserservice.service.ProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/profiles")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;
    private final CallerIdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<ProfileResponse> createProfile(@Valid @RequestBody ProfileRequest request,
                                                         @AuthenticationPrincipal Jwt jwt) {
        ProfileResponse created = profileService.createSellerProfile(request, identityResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/mine")
    public ResponseEntity<List<ProfileResponse>> getMyProfiles(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(profileService.listMyProfiles(identityResolver.resolve(jwt)));
    }

    @GetMapping("/shared-with-me")
    public ResponseEntity<List<ProfileResponse>> getSharedProfiles(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(profileService.listSharedProfiles(identityResolver.resolve(jwt)));
    }

    // 404 both when the profile is absent and when the caller cannot read it
    @GetMapping("/{profileId}")
    public ResponseEntity<ProfileResponse> getProfile(@PathVariable String profileId,
                                                      @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.of(profileService.getProfile(profileId, identityResolver.resolve(jwt)));
    }

    @PatchMapping("/{profileId}")
    public ResponseEntity<ProfileResponse> updateProfile(@PathVariable String profileId,
                                                         @Valid @RequestBody ProfileRequest request,
                                                         @AuthenticationPrincipal Jwt jwt) {
        ProfileResponse updated = profileService.updateSellerProfile(profileId, request, identityResolver.resolve(jwt));
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{profileId}")
    public ResponseEntity<Void> deleteProfile(@PathVariable String profileId, @AuthenticationPrincipal Jwt jwt) {
        profileService.deleteSellerProfile(profileId, identityResolver.resolve(jwt));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{profileId}/transfer")
    public ResponseEntity<ProfileResponse> transferOwnership(@PathVariable String profileId,
                                                             @Valid @RequestBody TransferOwnershipRequest request,
                                                             @AuthenticationPrincipal Jwt jwt) {
        ProfileResponse transferred = profileService.transferProfileOwnership(profileId, request,
                identityResolver.resolve(jwt));
        return ResponseEntity.ok(transferred);
    }
}
