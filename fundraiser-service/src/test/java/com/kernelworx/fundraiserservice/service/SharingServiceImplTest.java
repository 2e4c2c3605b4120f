package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.AccessDeniedException;
import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ConflictException;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.access.AccessResolver;
import com.kernelworx.fundraiserservice.access.AccessSteps;
import com.kernelworx.fundraiserservice.config.FundraiserProperties;
import com.kernelworx.fundraiserservice.dto.InviteRequest;
import com.kernelworx.fundraiserservice.dto.InviteResponse;
import com.kernelworx.fundraiserservice.dto.RedeemInviteRequest;
import com.kernelworx.fundraiserservice.dto.ShareRequest;
import com.kernelworx.fundraiserservice.dto.ShareResponse;
import com.kernelworx.fundraiserservice.mapper.SharingMapper;
import com.kernelworx.fundraiserservice.model.Account;
import com.kernelworx.fundraiserservice.model.Invite;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.model.Share;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.StoreErrorTranslator;
import com.kernelworx.fundraiserservice.repository.AccountRepository;
import com.kernelworx.fundraiserservice.repository.InviteRepository;
import com.kernelworx.fundraiserservice.repository.SellerProfileRepository;
import com.kernelworx.fundraiserservice.repository.ShareRepository;
import com.kernelworx.fundraiserservice.store.ConditionalWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.kernelworx.fundraiserservice.service.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SharingService Unit Tests")
class SharingServiceImplTest {

    @Mock
    private SellerProfileRepository profileRepository;
    @Mock
    private ShareRepository shareRepository;
    @Mock
    private InviteRepository inviteRepository;
    @Mock
    private AccountRepository accountRepository;

    private SharingServiceImpl sharingService;

    @BeforeEach
    void setUp() {
        AccessSteps accessSteps = new AccessSteps(new AccessResolver(profileRepository, shareRepository));
        sharingService = new SharingServiceImpl(shareRepository, inviteRepository, accountRepository,
                Mappers.getMapper(SharingMapper.class), new ConditionalWriter(), new FundraiserProperties(),
                accessSteps, new PipelineExecutor(new StoreErrorTranslator()));
    }

    @Nested
    @DisplayName("Create Invite Tests")
    class CreateInviteTests {

        @Test
        @DisplayName("should create an invite with the default expiry when the caller owns the profile")
        void createsInvite() {
            // Arrange
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(inviteRepository.saveAndFlush(any(Invite.class))).thenAnswer(invocation -> invocation.getArgument(0));
            InviteRequest request = new InviteRequest();
            request.setPermissions(EnumSet.of(Permission.READ));

            // Act
            InviteResponse response = sharingService.createProfileInvite("p1", request, caller(OWNER_ID));

            // Assert
            assertThat(response.getInviteCode()).hasSize(10).matches("[A-Z0-9]+");
            assertThat(response.getProfileId()).isEqualTo(PROFILE_ID);
            assertThat(response.getPermissions()).containsExactly(Permission.READ);
            assertThat(response.getCreatedBy()).isEqualTo("owner");
            assertThat(Duration.between(response.getCreatedAt(), response.getExpiresAt()).toDays()).isEqualTo(14);
        }

        @Test
        @DisplayName("should forbid a caller who only holds a WRITE share")
        void forbidsNonOwner() {
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            InviteRequest request = new InviteRequest();
            request.setPermissions(EnumSet.of(Permission.READ));

            assertThatThrownBy(() -> sharingService.createProfileInvite(PROFILE_ID, request, caller(WRITER_ID)))
                    .isInstanceOf(AccessDeniedException.class);
            verify(inviteRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("should report a code collision as a retryable conflict")
        void codeCollision() {
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(inviteRepository.saveAndFlush(any(Invite.class)))
                    .thenThrow(new DataIntegrityViolationException("duplicate key"));
            InviteRequest request = new InviteRequest();
            request.setPermissions(EnumSet.of(Permission.WRITE));
            request.setExpiresInDays(3);

            assertThatThrownBy(() -> sharingService.createProfileInvite(PROFILE_ID, request, caller(OWNER_ID)))
                    .isInstanceOf(ConflictException.class)
                    .hasMessage("Invite code collision, please retry");
        }
    }

    @Nested
    @DisplayName("Redeem Invite Tests")
    class RedeemInviteTests {

        private Invite invite;

        @BeforeEach
        void setUp() {
            invite = new Invite();
            invite.setInviteCode("ABCDEF1234");
            invite.setProfileId(PROFILE_ID);
            invite.setOwnerAccountId(OWNER_ID);
            invite.setCreatedBy(OWNER_ID);
            invite.setPermissions(EnumSet.of(Permission.READ, Permission.WRITE));
            invite.setCreatedAt(Instant.now());
            invite.setExpiresAt(Instant.now().plus(Duration.ofDays(1)));
        }

        @Test
        @DisplayName("should grant the invite's permissions and consume the invite")
        void redeems() {
            // Arrange
            when(inviteRepository.findById("ABCDEF1234")).thenReturn(Optional.of(invite));
            when(shareRepository.findConsistent(PROFILE_ID, READER_ID)).thenReturn(Optional.empty());
            when(shareRepository.save(any(Share.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(inviteRepository.markUsed(eq("ABCDEF1234"), eq(READER_ID), any(Instant.class))).thenReturn(1);

            // Act
            ShareResponse response = sharingService.redeemProfileInvite(redeem(" abcdef1234 "), caller(READER_ID));

            // Assert
            assertThat(response.getProfileId()).isEqualTo(PROFILE_ID);
            assertThat(response.getTargetAccountId()).isEqualTo("reader");
            assertThat(response.getPermissions()).containsExactlyInAnyOrder(Permission.READ, Permission.WRITE);
            assertThat(response.getCreatedByAccountId()).isEqualTo("reader");
        }

        @Test
        @DisplayName("should update an existing share and record the redeemer as its creator")
        void upgradesExistingShare() {
            Share existing = share(READER_ID, Permission.READ);
            when(inviteRepository.findById("ABCDEF1234")).thenReturn(Optional.of(invite));
            when(shareRepository.findConsistent(PROFILE_ID, READER_ID)).thenReturn(Optional.of(existing));
            when(shareRepository.save(existing)).thenReturn(existing);
            when(inviteRepository.markUsed(eq("ABCDEF1234"), eq(READER_ID), any(Instant.class))).thenReturn(1);

            sharingService.redeemProfileInvite(redeem("ABCDEF1234"), caller(READER_ID));

            assertThat(existing.getPermissions()).contains(Permission.WRITE);
            assertThat(existing.getCreatedByAccountId()).isEqualTo(READER_ID);
        }

        @Test
        @DisplayName("should reject an unknown code")
        void unknownCode() {
            when(inviteRepository.findById("NOPE")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> sharingService.redeemProfileInvite(redeem("nope"), caller(READER_ID)))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("Invalid invite code");
        }

        @Test
        @DisplayName("should reject a used invite")
        void usedInvite() {
            invite.setUsed(true);
            when(inviteRepository.findById("ABCDEF1234")).thenReturn(Optional.of(invite));

            assertThatThrownBy(() -> sharingService.redeemProfileInvite(redeem("ABCDEF1234"), caller(READER_ID)))
                    .isInstanceOf(ConflictException.class)
                    .hasMessage("Invite has already been used");
        }

        @Test
        @DisplayName("should reject an expired invite")
        void expiredInvite() {
            invite.setExpiresAt(Instant.now().minusSeconds(1));
            when(inviteRepository.findById("ABCDEF1234")).thenReturn(Optional.of(invite));

            assertThatThrownBy(() -> sharingService.redeemProfileInvite(redeem("ABCDEF1234"), caller(READER_ID)))
                    .isInstanceOf(ConflictException.class)
                    .hasMessage("Invite has expired");
        }

        @Test
        @DisplayName("should reject redeeming an invite to your own profile")
        void ownInvite() {
            when(inviteRepository.findById("ABCDEF1234")).thenReturn(Optional.of(invite));

            assertThatThrownBy(() -> sharingService.redeemProfileInvite(redeem("ABCDEF1234"), caller(OWNER_ID)))
                    .isInstanceOf(BadRequestException.class);
        }

        @Test
        @DisplayName("should conflict when a concurrent redeem consumed the invite first")
        void lostRace() {
            when(inviteRepository.findById("ABCDEF1234")).thenReturn(Optional.of(invite));
            when(shareRepository.findConsistent(PROFILE_ID, READER_ID)).thenReturn(Optional.empty());
            when(shareRepository.save(any(Share.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(inviteRepository.markUsed(eq("ABCDEF1234"), eq(READER_ID), any(Instant.class))).thenReturn(0);

            assertThatThrownBy(() -> sharingService.redeemProfileInvite(redeem("ABCDEF1234"), caller(READER_ID)))
                    .isInstanceOf(ConflictException.class)
                    .hasMessage("Invite has already been used");
        }

        private RedeemInviteRequest redeem(String code) {
            RedeemInviteRequest request = new RedeemInviteRequest();
            request.setInviteCode(code);
            return request;
        }
    }

    @Nested
    @DisplayName("Share Management Tests")
    class ShareManagementTests {

        @Test
        @DisplayName("should list invites newest first for a WRITE sharee and nothing for a READ sharee")
        void listInvitesByPermission() {
            Invite invite = new Invite();
            invite.setInviteCode("ABCDEF1234");
            invite.setProfileId(PROFILE_ID);
            invite.setOwnerAccountId(OWNER_ID);
            invite.setCreatedBy(OWNER_ID);
            invite.setPermissions(EnumSet.of(Permission.READ));
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(shareRepository.findConsistent(PROFILE_ID, WRITER_ID))
                    .thenReturn(Optional.of(share(WRITER_ID, Permission.WRITE)));
            when(shareRepository.findConsistent(PROFILE_ID, READER_ID))
                    .thenReturn(Optional.of(share(READER_ID, Permission.READ)));
            when(inviteRepository.findByProfileIdOrderByCreatedAtDesc(PROFILE_ID)).thenReturn(List.of(invite));

            assertThat(sharingService.listInvitesByProfile(PROFILE_ID, caller(WRITER_ID)))
                    .extracting(InviteResponse::getInviteCode)
                    .containsExactly("ABCDEF1234");
            assertThat(sharingService.listInvitesByProfile(PROFILE_ID, caller(READER_ID))).isEmpty();
        }

        @Test
        @DisplayName("should list shares for a WRITE sharee and nothing for a READ sharee")
        void listSharesByPermission() {
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(shareRepository.findConsistent(PROFILE_ID, WRITER_ID))
                    .thenReturn(Optional.of(share(WRITER_ID, Permission.WRITE)));
            when(shareRepository.findConsistent(PROFILE_ID, READER_ID))
                    .thenReturn(Optional.of(share(READER_ID, Permission.READ)));
            when(shareRepository.findByProfileId(PROFILE_ID))
                    .thenReturn(List.of(share(WRITER_ID, Permission.WRITE), share(READER_ID, Permission.READ)));

            assertThat(sharingService.listSharesByProfile(PROFILE_ID, caller(WRITER_ID))).hasSize(2);
            assertThat(sharingService.listSharesByProfile(PROFILE_ID, caller(READER_ID))).isEmpty();
        }

        @Test
        @DisplayName("should treat revoking a missing share as success")
        void revokeIdempotent() {
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(shareRepository.deleteShare(PROFILE_ID, READER_ID)).thenReturn(0);

            assertThatCode(() -> sharingService.revokeShare(PROFILE_ID, "SHARE#ACCOUNT#reader", caller(OWNER_ID)))
                    .doesNotThrowAnyException();
            verify(shareRepository).deleteShare(PROFILE_ID, READER_ID);
        }

        @Test
        @DisplayName("should reject sharing a profile with its owner")
        void shareWithOwner() {
            Account owner = new Account();
            owner.setAccountId(OWNER_ID);
            owner.setEmail("owner@example.com");
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(accountRepository.findByEmailIgnoreCase("owner@example.com")).thenReturn(Optional.of(owner));

            ShareRequest request = new ShareRequest();
            request.setTargetAccountEmail("owner@example.com");
            request.setPermissions(Set.of(Permission.READ));

            assertThatThrownBy(() -> sharingService.shareProfileDirect(PROFILE_ID, request, caller(OWNER_ID)))
                    .isInstanceOf(BadRequestException.class);
            verify(shareRepository, never()).save(any());
        }

        @Test
        @DisplayName("should report an unknown email as not found")
        void shareWithUnknownEmail() {
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(accountRepository.findByEmailIgnoreCase(anyString())).thenReturn(Optional.empty());

            ShareRequest request = new ShareRequest();
            request.setTargetAccountEmail("nobody@example.com");
            request.setPermissions(Set.of(Permission.READ));

            assertThatThrownBy(() -> sharingService.shareProfileDirect(PROFILE_ID, request, caller(OWNER_ID)))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining("nobody@example.com");
        }
    }

    @Test
    @DisplayName("generated codes use the configured alphabet and length")
    void generatedCodes() {
        String code = sharingService.generateCode();

        assertThat(code).matches("[A-Z0-9]{10}");
        assertThat(sharingService.generateCode()).isNotEqualTo(code);
    }
}
