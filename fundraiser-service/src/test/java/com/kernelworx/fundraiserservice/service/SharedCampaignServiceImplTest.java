package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.AccessDeniedException;
import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ConflictException;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.config.FundraiserProperties;
import com.kernelworx.fundraiserservice.dto.SharedCampaignRequest;
import com.kernelworx.fundraiserservice.dto.SharedCampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateSharedCampaignRequest;
import com.kernelworx.fundraiserservice.mapper.SharedCampaignMapper;
import com.kernelworx.fundraiserservice.model.Account;
import com.kernelworx.fundraiserservice.model.Catalog;
import com.kernelworx.fundraiserservice.model.SharedCampaignTemplate;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.StoreErrorTranslator;
import com.kernelworx.fundraiserservice.repository.AccountRepository;
import com.kernelworx.fundraiserservice.repository.CatalogRepository;
import com.kernelworx.fundraiserservice.repository.SharedCampaignRepository;
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

import java.util.List;
import java.util.Optional;

import static com.kernelworx.fundraiserservice.service.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SharedCampaignService Unit Tests")
class SharedCampaignServiceImplTest {

    private static final String CODE = "PACK158-POPC-IL-25";

    @Mock
    private SharedCampaignRepository sharedCampaignRepository;
    @Mock
    private CatalogRepository catalogRepository;
    @Mock
    private AccountRepository accountRepository;

    private SharedCampaignServiceImpl sharedCampaignService;

    @BeforeEach
    void setUp() {
        FundraiserProperties properties = new FundraiserProperties();
        properties.getSharedCampaigns().setMaxPerCreator(2);
        sharedCampaignService = new SharedCampaignServiceImpl(sharedCampaignRepository, catalogRepository,
                accountRepository, Mappers.getMapper(SharedCampaignMapper.class), new ConditionalWriter(),
                properties, new PipelineExecutor(new StoreErrorTranslator()));
    }

    @Nested
    @DisplayName("Create Shared Campaign Tests")
    class CreateTests {

        @Test
        @DisplayName("should derive code, discovery key and creator name")
        void creates() {
            Account account = new Account();
            account.setGivenName("Dana");
            account.setFamilyName("Leader");
            when(sharedCampaignRepository.countByCreatedBy(OWNER_ID)).thenReturn(0L);
            when(catalogRepository.findById("CATALOG#c1")).thenReturn(Optional.of(catalog()));
            when(accountRepository.findById(OWNER_ID)).thenReturn(Optional.of(account));
            when(sharedCampaignRepository.saveAndFlush(any(SharedCampaignTemplate.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            SharedCampaignResponse response = sharedCampaignService.createSharedCampaign(request(), caller(OWNER_ID));

            assertThat(response.getSharedCampaignCode()).isEqualTo(CODE);
            assertThat(response.getCatalogId()).isEqualTo("CATALOG#c1");
            assertThat(response.getCreatedBy()).isEqualTo("owner");
            assertThat(response.getCreatedByName()).isEqualTo("Dana Leader");
            assertThat(response.getIsActive()).isTrue();
        }

        @Test
        @DisplayName("should fall back to the caller's name when no account row exists")
        void callerNameFallback() {
            when(sharedCampaignRepository.countByCreatedBy(OWNER_ID)).thenReturn(0L);
            when(catalogRepository.findById("CATALOG#c1")).thenReturn(Optional.of(catalog()));
            when(accountRepository.findById(OWNER_ID)).thenReturn(Optional.empty());
            when(sharedCampaignRepository.saveAndFlush(any(SharedCampaignTemplate.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            SharedCampaignResponse response = sharedCampaignService.createSharedCampaign(request(), caller(OWNER_ID));

            assertThat(response.getCreatedByName()).isEqualTo("Test User");
        }

        @Test
        @DisplayName("should stop at the per-creator limit")
        void limitReached() {
            when(sharedCampaignRepository.countByCreatedBy(OWNER_ID)).thenReturn(2L);

            assertThatThrownBy(() -> sharedCampaignService.createSharedCampaign(request(), caller(OWNER_ID)))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessage("You can create at most 2 shared campaigns");
            verify(catalogRepository, never()).findById(any());
        }

        @Test
        @DisplayName("should reject a deleted catalog")
        void deletedCatalog() {
            Catalog catalog = catalog();
            catalog.setIsDeleted(true);
            when(sharedCampaignRepository.countByCreatedBy(OWNER_ID)).thenReturn(0L);
            when(catalogRepository.findById("CATALOG#c1")).thenReturn(Optional.of(catalog));

            assertThatThrownBy(() -> sharedCampaignService.createSharedCampaign(request(), caller(OWNER_ID)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("should report a taken code as a conflict")
        void duplicateCode() {
            when(sharedCampaignRepository.countByCreatedBy(OWNER_ID)).thenReturn(1L);
            when(catalogRepository.findById("CATALOG#c1")).thenReturn(Optional.of(catalog()));
            when(accountRepository.findById(OWNER_ID)).thenReturn(Optional.empty());
            when(sharedCampaignRepository.saveAndFlush(any(SharedCampaignTemplate.class)))
                    .thenThrow(new DataIntegrityViolationException("duplicate key"));

            assertThatThrownBy(() -> sharedCampaignService.createSharedCampaign(request(), caller(OWNER_ID)))
                    .isInstanceOf(ConflictException.class)
                    .hasMessage(SharedCampaignServiceImpl.DUPLICATE_CODE_MESSAGE);
        }
    }

    @Test
    @DisplayName("should look codes up case-insensitively")
    void getByCode() {
        when(sharedCampaignRepository.findById(CODE)).thenReturn(Optional.of(template(OWNER_ID, true)));

        assertThat(sharedCampaignService.getSharedCampaign(" pack158-popc-il-25 ")).isPresent();
        assertThat(sharedCampaignService.getSharedCampaign(" ")).isEmpty();
    }

    @Nested
    @DisplayName("Discovery Tests")
    class DiscoveryTests {

        @Test
        @DisplayName("should return only active templates for the unit campaign")
        void filtersInactive() {
            SharedCampaignTemplate unset = template(OWNER_ID, true);
            unset.setIsActive(null);
            when(sharedCampaignRepository.findByUnitCampaignKey("Pack#158#Springfield#IL#Popcorn#2025"))
                    .thenReturn(List.of(template(OWNER_ID, false), unset));

            List<SharedCampaignResponse> found = sharedCampaignService.findSharedCampaigns(
                    "Pack", "158", "Springfield", "IL", "Popcorn", 2025);

            assertThat(found).hasSize(1);
            assertThat(found.get(0).getIsActive()).isTrue();
        }

        @Test
        @DisplayName("should treat a template with no active flag as active")
        void unsetFlagIsActive() {
            SharedCampaignTemplate unset = template(OWNER_ID, true);
            unset.setIsActive(null);
            when(sharedCampaignRepository.findByUnitCampaignKey("Pack#158#Springfield#IL#Popcorn#2025"))
                    .thenReturn(List.of(unset));

            List<SharedCampaignResponse> found = sharedCampaignService.findSharedCampaigns(
                    "Pack", "158", "Springfield", "IL", "Popcorn", 2025);

            assertThat(found).singleElement().satisfies(response -> {
                assertThat(response.getSharedCampaignCode()).isEqualTo(CODE);
                assertThat(response.getIsActive()).isTrue();
            });
        }

        @Test
        @DisplayName("should return an empty list when no template matches")
        void noMatches() {
            when(sharedCampaignRepository.findByUnitCampaignKey("Pack#158#Springfield#IL#Popcorn#2025"))
                    .thenReturn(List.of());

            assertThat(sharedCampaignService.findSharedCampaigns(
                    "Pack", "158", "Springfield", "IL", "Popcorn", 2025)).isEmpty();
        }

        @Test
        @DisplayName("should require every key component")
        void requiresAllParts() {
            assertThatThrownBy(() -> sharedCampaignService.findSharedCampaigns(
                    "Pack", "158", null, "IL", "Popcorn", 2025))
                    .isInstanceOf(BadRequestException.class);
        }
    }

    @Nested
    @DisplayName("Update and Delete Tests")
    class UpdateDeleteTests {

        @Test
        @DisplayName("should let the creator deactivate a template")
        void deactivate() {
            SharedCampaignTemplate template = template(OWNER_ID, true);
            when(sharedCampaignRepository.findById(CODE)).thenReturn(Optional.of(template));
            when(sharedCampaignRepository.save(template)).thenReturn(template);
            UpdateSharedCampaignRequest request = new UpdateSharedCampaignRequest();
            request.setIsActive(false);

            SharedCampaignResponse response = sharedCampaignService.updateSharedCampaign(CODE, request, caller(OWNER_ID));

            assertThat(response.getIsActive()).isFalse();
            assertThat(response.getCreatorMessage()).isEqualTo("Welcome!");
        }

        @Test
        @DisplayName("should forbid other accounts from updating or deleting")
        void nonCreatorForbidden() {
            when(sharedCampaignRepository.findById(CODE)).thenReturn(Optional.of(template(OWNER_ID, true)));

            assertThatThrownBy(() -> sharedCampaignService.updateSharedCampaign(CODE,
                    new UpdateSharedCampaignRequest(), caller(STRANGER_ID)))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> sharedCampaignService.deleteSharedCampaign(CODE, caller(STRANGER_ID)))
                    .isInstanceOf(AccessDeniedException.class);
            verify(sharedCampaignRepository, never()).delete(any());
        }

        @Test
        @DisplayName("should treat deleting an absent template as done")
        void deleteAbsent() {
            when(sharedCampaignRepository.findById(CODE)).thenReturn(Optional.empty());

            sharedCampaignService.deleteSharedCampaign(CODE, caller(OWNER_ID));

            verify(sharedCampaignRepository, never()).delete(any());
        }

        @Test
        @DisplayName("should succeed when the same template is deleted twice")
        void deleteTwice() {
            SharedCampaignTemplate template = template(OWNER_ID, true);
            when(sharedCampaignRepository.findById(CODE)).thenReturn(Optional.of(template), Optional.empty());

            sharedCampaignService.deleteSharedCampaign(CODE, caller(OWNER_ID));
            assertThatCode(() -> sharedCampaignService.deleteSharedCampaign(CODE, caller(OWNER_ID)))
                    .doesNotThrowAnyException();

            verify(sharedCampaignRepository, times(1)).delete(template);
        }
    }

    private static SharedCampaignRequest request() {
        SharedCampaignRequest request = new SharedCampaignRequest();
        request.setCatalogId("c1");
        request.setCampaignName("Popcorn");
        request.setCampaignYear(2025);
        request.setUnitType("Pack");
        request.setUnitNumber("158");
        request.setCity("Springfield");
        request.setState("IL");
        return request;
    }

    private static Catalog catalog() {
        Catalog catalog = new Catalog();
        catalog.setCatalogId("CATALOG#c1");
        catalog.setOwnerAccountId(OWNER_ID);
        return catalog;
    }

    private static SharedCampaignTemplate template(String createdBy, boolean active) {
        SharedCampaignTemplate template = new SharedCampaignTemplate();
        template.setSharedCampaignCode(CODE);
        template.setCatalogId("CATALOG#c1");
        template.setCampaignName("Popcorn");
        template.setCampaignYear(2025);
        template.setUnitType("Pack");
        template.setUnitNumber("158");
        template.setCity("Springfield");
        template.setState("IL");
        template.setCreatedBy(createdBy);
        template.setCreatorMessage("Welcome!");
        template.setIsActive(active);
        return template;
    }
}
