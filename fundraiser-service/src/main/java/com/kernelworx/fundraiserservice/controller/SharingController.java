package com.kernelworx.fundraiserservice.controller;

import com.kernelworx.fundraiserservice.dto.InviteRequest;
import com.kernelworx.fundraiserservice.dto.InviteResponse;
import com.kernelworx.fundraiserservice.dto.RedeemInviteRequest;
import com.kernelworx.fundraiserservice.dto.ShareRequest;
import com.kernelworx.fundraiserservice.dto.ShareResponse;
import com.kernelworx.fundraiserservice.security.CallerIdentityResolver;
import com.kernelworx.fundraiserservice.service.SharingService;
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
public class SharingController {

    private final SharingService sharingService;
    private final CallerIdentityResolver identityResolver;

    @PostMapping("/profiles/{profileId}/invites")
    public ResponseEntity<InviteResponse> createInvite(@PathVariable String profileId,
                                                       @Valid @RequestBody InviteRequest request,
                                                       @AuthenticationPrincipal Jwt jwt) {
        InviteResponse invite = sharingService.createProfileInvite(profileId, request, identityResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(invite);
    }

    @GetMapping("/profiles/{profileId}/invites")
    public ResponseEntity<List<InviteResponse>> listInvites(@PathVariable String profileId,
                                                            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(sharingService.listInvitesByProfile(profileId, identityResolver.resolve(jwt)));
    }

    @DeleteMapping("/profiles/{profileId}/invites/{inviteCode}")
    public ResponseEntity<Void> deleteInvite(@PathVariable String profileId, @PathVariable String inviteCode,
                                             @AuthenticationPrincipal Jwt jwt) {
        sharingService.deleteProfileInvite(profileId, inviteCode, identityResolver.resolve(jwt));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/invites/redeem")
    public ResponseEntity<ShareResponse> redeemInvite(@Valid @RequestBody RedeemInviteRequest request,
                                                      @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(sharingService.redeemProfileInvite(request, identityResolver.resolve(jwt)));
    }

    @PostMapping("/profiles/{profileId}/shares")
    public ResponseEntity<ShareResponse> shareDirect(@PathVariable String profileId,
                                                     @Valid @RequestBody ShareRequest request,
                                                     @AuthenticationPrincipal Jwt jwt) {
        ShareResponse share = sharingService.shareProfileDirect(profileId, request, identityResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(share);
    }

    @GetMapping("/profiles/{profileId}/shares")
    public ResponseEntity<List<ShareResponse>> listShares(@PathVariable String profileId,
                                                          @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(sharingService.listSharesByProfile(profileId, identityResolver.resolve(jwt)));
    }

    @DeleteMapping("/profiles/{profileId}/shares/{targetAccountId}")
    public ResponseEntity<Void> revokeShare(@PathVariable String profileId, @PathVariable String targetAccountId,
                                            @AuthenticationPrincipal Jwt jwt) {
        sharingService.revokeShare(profileId, targetAccountId, identityResolver.resolve(jwt));
        return ResponseEntity.noContent().build();
    }
}
