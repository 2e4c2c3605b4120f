package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.AccessDeniedException;
import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.access.AccessResolver;
import com.kernelworx.fundraiserservice.access.AccessSteps;
import com.kernelworx.fundraiserservice.dto.CampaignRequest;
import com.kernelworx.fundraiserservice.dto.CampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateCampaignRequest;
import com.kernelworx.fundraiserservice.mapper.CampaignMapper;
import com.kernelworx.fundraiserservice.model.Campaign;
import com.kernelworx.fundraiserservice.model.Catalog;
import com.kernelworx.fundraiserservice.model.Order;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.model.Share;
import com.kernelworx.fundraiserservice.model.SharedCampaignTemplate;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.StoreErrorTranslator;
import com.kernelworx.fundraiserservice.repository.CampaignRepository;
import com.kernelworx.fundraiserservice.repository.CampaignTotals;
import com.kernelworx.fundraiserservice.repository.CatalogRepository;
import com.kernelworx.fundraiserservice.repository.OrderRepository;
import com.kernelworx.fundraiserservice.repository.SellerProfileRepository;
import com.kernelworx.fundraiserservice.repository.ShareRepository;
import com.kernelworx.fundraiserservice.repository.SharedCampaignRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.kernelworx.fundraiserservice.service.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CampaignService Unit Tests")
class CampaignServiceImplTest {

    private static final String CATALOG_ID = "CATALOG#cat1";
    private static final String CREATOR_ID = "ACCOUNT#leader";

    @Mock
    private SellerProfileRepository profileRepository;
    @Mock
    private ShareRepository shareRepository;
    @Mock
    private CampaignRepository campaignRepository;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private CatalogRepository catalogRepository;
    @Mock
    private SharedCampaignRepository sharedCampaignRepository;

    private CampaignServiceImpl campaignService;
    private Catalog catalog;

    @BeforeEach
    void setUp() {
        AccessResolver accessResolver = new AccessResolver(profileRepository, shareRepository);
        campaignService = new CampaignServiceImpl(campaignRepository, orderRepository, catalogRepository,
                sharedCampaignRepository, shareRepository, accessResolver, Mappers.getMapper(CampaignMapper.class),
                new AccessSteps(accessResolver), new PipelineExecutor(new StoreErrorTranslator()));

        catalog = new Catalog();
        catalog.setCatalogId(CATALOG_ID);
        catalog.setIsDeleted(false);
    }

    @Nested
    @DisplayName("Create Campaign Tests")
    class CreateCampaignTests {

        @Test
        @DisplayName("should create a campaign with a canonical catalog id and zero totals")
        void createsCampaign() {
            // Arrange
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(catalogRepository.findById(CATALOG_ID)).thenReturn(Optional.of(catalog));
            when(campaignRepository.save(any(Campaign.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(orderRepository.summarize(any())).thenReturn(totals(0L, BigDecimal.ZERO));
            CampaignRequest request = baseRequest();

            // Act
            CampaignResponse response = campaignService.createCampaign(request, caller(OWNER_ID));

            // Assert
            assertThat(response.getCampaignId()).startsWith("CAMPAIGN#");
            assertThat(response.getCatalogId()).isEqualTo(CATALOG_ID);
            assertThat(response.getTotalOrders()).isZero();
            assertThat(response.getTotalRevenue()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("should prefill from a shared campaign and share with its creator")
        void prefillsAndShares() {
            // Arrange
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(sharedCampaignRepository.findById("PACK158-POPC-IL-25")).thenReturn(Optional.of(template()));
            when(catalogRepository.findById(CATALOG_ID)).thenReturn(Optional.of(catalog));
            when(campaignRepository.save(any(Campaign.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(shareRepository.findConsistent(PROFILE_ID, CREATOR_ID)).thenReturn(Optional.empty());
            when(shareRepository.save(any(Share.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(orderRepository.summarize(any())).thenReturn(totals(0L, BigDecimal.ZERO));

            CampaignRequest request = new CampaignRequest();
            request.setProfileId(PROFILE_ID);
            request.setSharedCampaignCode("pack158-popc-il-25");
            request.setStartDate(LocalDate.of(2025, 9, 15));
            request.setShareWithCreator(true);

            // Act
            CampaignResponse response = campaignService.createCampaign(request, caller(OWNER_ID));

            // Assert
            assertThat(response.getCampaignName()).isEqualTo("Popcorn");
            assertThat(response.getCampaignYear()).isEqualTo(2025);
            assertThat(response.getStartDate()).isEqualTo(LocalDate.of(2025, 9, 15));
            assertThat(response.getCity()).isEqualTo("Springfield");
            assertThat(response.getSharedCampaignCode()).isEqualTo("PACK158-POPC-IL-25");

            ArgumentCaptor<Share> captor = ArgumentCaptor.forClass(Share.class);
            verify(shareRepository).save(captor.capture());
            assertThat(captor.getValue().getTargetAccountId()).isEqualTo(CREATOR_ID);
            assertThat(captor.getValue().getPermissions()).containsExactly(Permission.READ);
        }

        @Test
        @DisplayName("should grant READ on the creator's existing empty share instead of adding a second one")
        void upgradesEmptyCreatorShare() {
            Share existing = share(CREATOR_ID);
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(sharedCampaignRepository.findById("PACK158-POPC-IL-25")).thenReturn(Optional.of(template()));
            when(catalogRepository.findById(CATALOG_ID)).thenReturn(Optional.of(catalog));
            when(campaignRepository.save(any(Campaign.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(shareRepository.findConsistent(PROFILE_ID, CREATOR_ID)).thenReturn(Optional.of(existing));
            when(shareRepository.save(existing)).thenReturn(existing);
            when(orderRepository.summarize(any())).thenReturn(totals(0L, BigDecimal.ZERO));

            CampaignRequest request = new CampaignRequest();
            request.setProfileId(PROFILE_ID);
            request.setSharedCampaignCode("PACK158-POPC-IL-25");
            request.setShareWithCreator(true);

            campaignService.createCampaign(request, caller(OWNER_ID));

            ArgumentCaptor<Share> captor = ArgumentCaptor.forClass(Share.class);
            verify(shareRepository).save(captor.capture());
            assertThat(captor.getValue()).isSameAs(existing);
            assertThat(existing.getPermissions()).containsExactly(Permission.READ);
        }

        @Test
        @DisplayName("should reject an inactive shared campaign")
        void inactiveTemplate() {
            SharedCampaignTemplate template = template();
            template.setIsActive(false);
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(sharedCampaignRepository.findById("PACK158-POPC-IL-25")).thenReturn(Optional.of(template));

            CampaignRequest request = baseRequest();
            request.setSharedCampaignCode("PACK158-POPC-IL-25");

            assertThatThrownBy(() -> campaignService.createCampaign(request, caller(OWNER_ID)))
                    .isInstanceOf(BadRequestException.class);
            verify(campaignRepository, never()).save(any());
        }

        @Test
        @DisplayName("should require a start date")
        void requiresStartDate() {
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            CampaignRequest request = baseRequest();
            request.setStartDate(null);

            assertThatThrownBy(() -> campaignService.createCampaign(request, caller(OWNER_ID)))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessage("Start date is required");
        }

        @Test
        @DisplayName("should require the full unit when a unit type is given")
        void requiresFullUnit() {
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            CampaignRequest request = baseRequest();
            request.setUnitType("Pack");
            request.setUnitNumber("158");

            assertThatThrownBy(() -> campaignService.createCampaign(request, caller(OWNER_ID)))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("city and state");
        }

        @Test
        @DisplayName("should not accept a deleted catalog")
        void deletedCatalog() {
            catalog.setIsDeleted(true);
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(catalogRepository.findById(CATALOG_ID)).thenReturn(Optional.of(catalog));

            assertThatThrownBy(() -> campaignService.createCampaign(baseRequest(), caller(OWNER_ID)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("should forbid a caller without a share")
        void forbidsStranger() {
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(shareRepository.findConsistent(PROFILE_ID, STRANGER_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> campaignService.createCampaign(baseRequest(), caller(STRANGER_ID)))
                    .isInstanceOf(AccessDeniedException.class);
        }
    }

    @Test
    @DisplayName("should list the profile's campaigns with their totals for the owner")
    void listForOwner() {
        when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
        when(campaignRepository.findByProfileIdOrderByStartDateDesc(PROFILE_ID)).thenReturn(List.of(storedCampaign()));
        when(orderRepository.summarize("CAMPAIGN#c1")).thenReturn(totals(3L, new BigDecimal("45.00")));

        List<CampaignResponse> campaigns = campaignService.listCampaignsByProfile("p1", caller(OWNER_ID));

        assertThat(campaigns).singleElement().satisfies(campaign -> {
            assertThat(campaign.getCampaignId()).isEqualTo("CAMPAIGN#c1");
            assertThat(campaign.getTotalOrders()).isEqualTo(3L);
            assertThat(campaign.getTotalRevenue()).isEqualByComparingTo("45.00");
        });
    }

    @Test
    @DisplayName("should list nothing for a caller without access")
    void listDenied() {
        when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
        when(shareRepository.findConsistent(PROFILE_ID, STRANGER_ID)).thenReturn(Optional.empty());

        assertThat(campaignService.listCampaignsByProfile(PROFILE_ID, caller(STRANGER_ID))).isEmpty();
        verify(campaignRepository, never()).findByProfileIdOrderByStartDateDesc(any());
    }

    @Nested
    @DisplayName("Update Campaign Tests")
    class UpdateCampaignTests {

        @Test
        @DisplayName("should require the full unit when an update sets a unit type")
        void requiresFullUnit() {
            Campaign stored = storedCampaign();
            when(campaignRepository.findById("CAMPAIGN#c1")).thenReturn(Optional.of(stored));
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            UpdateCampaignRequest request = new UpdateCampaignRequest();
            request.setUnitType("Pack");
            request.setUnitNumber("158");

            assertThatThrownBy(() -> campaignService.updateCampaign("c1", request, caller(OWNER_ID)))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("city and state");
            verify(campaignRepository, never()).save(any());
        }

        @Test
        @DisplayName("should accept an update that completes the unit")
        void acceptsFullUnit() {
            Campaign stored = storedCampaign();
            when(campaignRepository.findById("CAMPAIGN#c1")).thenReturn(Optional.of(stored));
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(campaignRepository.save(stored)).thenReturn(stored);
            when(orderRepository.summarize("CAMPAIGN#c1")).thenReturn(totals(0L, BigDecimal.ZERO));
            UpdateCampaignRequest request = new UpdateCampaignRequest();
            request.setUnitType("Pack");
            request.setUnitNumber("158");
            request.setCity("Springfield");
            request.setState("IL");

            CampaignResponse response = campaignService.updateCampaign("c1", request, caller(OWNER_ID));

            assertThat(response.getUnitType()).isEqualTo("Pack");
            assertThat(stored.getUnitCampaignKey()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Delete Campaign Tests")
    class DeleteCampaignTests {

        @Test
        @DisplayName("should treat deleting a missing campaign as success")
        void deleteMissing() {
            when(campaignRepository.findById("CAMPAIGN#c1")).thenReturn(Optional.empty());

            assertThatCode(() -> campaignService.deleteCampaign("c1", caller(STRANGER_ID)))
                    .doesNotThrowAnyException();
            verify(campaignRepository, never()).delete(any());
            verify(orderRepository, never()).deleteAll(any());
        }

        @Test
        @DisplayName("should succeed when the same campaign is deleted twice")
        void deleteTwice() {
            Campaign stored = storedCampaign();
            when(campaignRepository.findById("CAMPAIGN#c1")).thenReturn(Optional.of(stored), Optional.empty());
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
            when(orderRepository.findByCampaignIdOrderByCreatedAtAsc("CAMPAIGN#c1")).thenReturn(List.of());

            campaignService.deleteCampaign("c1", caller(OWNER_ID));
            assertThatCode(() -> campaignService.deleteCampaign("c1", caller(OWNER_ID)))
                    .doesNotThrowAnyException();

            verify(campaignRepository, times(1)).delete(stored);
        }
    }

    @Test
    @DisplayName("should delete the campaign's orders before the campaign")
    void deleteCascades() {
        Campaign campaign = new Campaign();
        campaign.setCampaignId("CAMPAIGN#c1");
        campaign.setProfileId(PROFILE_ID);
        List<Order> orders = List.of(new Order(), new Order());
        when(campaignRepository.findById("CAMPAIGN#c1")).thenReturn(Optional.of(campaign));
        when(profileRepository.findById(PROFILE_ID)).thenReturn(Optional.of(profile()));
        when(orderRepository.findByCampaignIdOrderByCreatedAtAsc("CAMPAIGN#c1")).thenReturn(orders);

        campaignService.deleteCampaign("c1", caller(OWNER_ID));

        InOrder order = inOrder(orderRepository, campaignRepository);
        order.verify(orderRepository).deleteAll(orders);
        order.verify(campaignRepository).delete(campaign);
    }

    private Campaign storedCampaign() {
        Campaign campaign = new Campaign();
        campaign.setCampaignId("CAMPAIGN#c1");
        campaign.setProfileId(PROFILE_ID);
        campaign.setCatalogId(CATALOG_ID);
        campaign.setCampaignName("Fall Sale");
        campaign.setCampaignYear(2025);
        campaign.setStartDate(LocalDate.of(2025, 9, 1));
        return campaign;
    }

    private CampaignRequest baseRequest() {
        CampaignRequest request = new CampaignRequest();
        request.setProfileId("p1");
        request.setCampaignName("Fall Sale");
        request.setCampaignYear(2025);
        request.setStartDate(LocalDate.of(2025, 9, 1));
        request.setCatalogId("cat1");
        return request;
    }

    private SharedCampaignTemplate template() {
        SharedCampaignTemplate template = new SharedCampaignTemplate();
        template.setSharedCampaignCode("PACK158-POPC-IL-25");
        template.setCatalogId(CATALOG_ID);
        template.setCampaignName("Popcorn");
        template.setCampaignYear(2025);
        template.setStartDate(LocalDate.of(2025, 9, 1));
        template.setUnitType("Pack");
        template.setUnitNumber("158");
        template.setCity("Springfield");
        template.setState("IL");
        template.setCreatedBy(CREATOR_ID);
        template.setIsActive(true);
        return template;
    }

    private static CampaignTotals totals(Long count, BigDecimal revenue) {
        return new CampaignTotals() {
            @Override
            public Long getOrderCount() {
                return count;
            }

            @Override
            public BigDecimal getRevenue() {
                return revenue;
            }
        };
    }
}
