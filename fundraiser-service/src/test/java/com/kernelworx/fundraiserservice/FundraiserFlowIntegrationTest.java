package com.kernelworx.fundraiserservice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import com.kernelworx.fundraiserservice.dto.CampaignRequest;
import com.kernelworx.fundraiserservice.dto.CatalogRequest;
import com.kernelworx.fundraiserservice.dto.InviteRequest;
import com.kernelworx.fundraiserservice.dto.LineItemRequest;
import com.kernelworx.fundraiserservice.dto.OrderRequest;
import com.kernelworx.fundraiserservice.dto.ProductRequest;
import com.kernelworx.fundraiserservice.dto.ProfileRequest;
import com.kernelworx.fundraiserservice.dto.RedeemInviteRequest;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.repository.AccountRepository;
import com.kernelworx.fundraiserservice.repository.CampaignRepository;
import com.kernelworx.fundraiserservice.repository.CatalogRepository;
import com.kernelworx.fundraiserservice.repository.InviteRepository;
import com.kernelworx.fundraiserservice.repository.OrderRepository;
import com.kernelworx.fundraiserservice.repository.SellerProfileRepository;
import com.kernelworx.fundraiserservice.repository.ShareRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end flow over the REST API against a real database: a seller sets up
 * a profile, catalog, campaign and order, then shares the profile.
 */
@AutoConfigureMockMvc
class FundraiserFlowIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OrderRepository orderRepository;
    @Autowired
    private CampaignRepository campaignRepository;
    @Autowired
    private InviteRepository inviteRepository;
    @Autowired
    private ShareRepository shareRepository;
    @Autowired
    private SellerProfileRepository profileRepository;
    @Autowired
    private CatalogRepository catalogRepository;
    @Autowired
    private AccountRepository accountRepository;

    @AfterEach
    void cleanup() {
        orderRepository.deleteAll();
        campaignRepository.deleteAll();
        inviteRepository.deleteAll();
        shareRepository.deleteAll();
        profileRepository.deleteAll();
        catalogRepository.deleteAll();
        accountRepository.deleteAll();
    }

    @Test
    @DisplayName("should price an order from the catalog and roll it into campaign totals")
    void sellerFlow() throws Exception {
        String profileId = createProfile();
        String catalogJson = postCreated("/api/v1/catalogs", catalog(), "seller");
        String catalogId = JsonPath.read(catalogJson, "$.catalogId");
        String productId = JsonPath.read(catalogJson, "$.products[0].productId");
        String campaignId = JsonPath.read(postCreated("/api/v1/campaigns", campaign(profileId, catalogId), "seller"),
                "$.campaignId");

        mockMvc.perform(post("/api/v1/orders")
                        .with(as("seller"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(order(profileId, campaignId, productId))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.totalAmount").value(30.0))
                .andExpect(jsonPath("$.lineItems[0].pricePerUnit").value(15.0))
                .andExpect(jsonPath("$.paymentMethod").value("Cash"));

        mockMvc.perform(get("/api/v1/campaigns/{campaignId}", campaignId).with(as("seller")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOrders").value(1))
                .andExpect(jsonPath("$.totalRevenue").value(30.0));

        // the catalog is in use now
        mockMvc.perform(delete("/api/v1/catalogs/{catalogId}", catalogId).with(as("seller")))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("should keep other accounts out until an invite is redeemed")
    void sharingFlow() throws Exception {
        String profileId = createProfile();
        mockMvc.perform(get("/api/v1/profiles/{profileId}", profileId).with(as("helper")))
                .andExpect(status().isNotFound());
        mockMvc.perform(patch("/api/v1/profiles/{profileId}", profileId)
                        .with(as("helper"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(profile("Hijacked"))))
                .andExpect(status().isForbidden());

        InviteRequest invite = new InviteRequest();
        invite.setPermissions(Set.of(Permission.READ));
        String inviteCode = JsonPath.read(postCreated("/api/v1/profiles/{profileId}/invites", invite, "seller", profileId),
                "$.inviteCode");

        RedeemInviteRequest redeem = new RedeemInviteRequest();
        redeem.setInviteCode(inviteCode);
        mockMvc.perform(post("/api/v1/invites/redeem")
                        .with(as("helper"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(redeem)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetAccountId").value("helper"));

        mockMvc.perform(get("/api/v1/profiles/{profileId}", profileId).with(as("helper")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isOwner").value(false))
                .andExpect(jsonPath("$.permissions[0]").value("READ"));

        // single use
        mockMvc.perform(post("/api/v1/invites/redeem")
                        .with(as("third"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(redeem)))
                .andExpect(status().isConflict());

        // READ does not allow edits
        mockMvc.perform(patch("/api/v1/profiles/{profileId}", profileId)
                        .with(as("helper"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(profile("Hijacked"))))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("should reject requests without a token")
    void requiresAuthentication() throws Exception {
        mockMvc.perform(get("/api/v1/profiles/mine"))
                .andExpect(status().isUnauthorized());
    }

    private String createProfile() throws Exception {
        return JsonPath.read(postCreated("/api/v1/profiles", profile("Scout Sam"), "seller"), "$.profileId");
    }

    private String postCreated(String path, Object body, String subject, Object... uriVariables) throws Exception {
        return mockMvc.perform(post(path, uriVariables)
                        .with(as(subject))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andReturn()
                .getResponse()
                .getContentAsString();
    }

    private static RequestPostProcessor as(String subject) {
        return jwt().jwt(builder -> builder
                .subject(subject)
                .claim("email", subject + "@example.com")
                .claim("given_name", subject));
    }

    private static ProfileRequest profile(String name) {
        ProfileRequest request = new ProfileRequest();
        request.setSellerName(name);
        return request;
    }

    private static CatalogRequest catalog() {
        ProductRequest product = new ProductRequest();
        product.setProductName("Caramel Corn");
        product.setPrice(new BigDecimal("15.00"));
        CatalogRequest request = new CatalogRequest();
        request.setCatalogName("Fall Sale");
        request.setProducts(List.of(product));
        return request;
    }

    private static CampaignRequest campaign(String profileId, String catalogId) {
        CampaignRequest request = new CampaignRequest();
        request.setProfileId(profileId);
        request.setCatalogId(catalogId);
        request.setCampaignName("Fall Popcorn");
        request.setCampaignYear(2025);
        request.setStartDate(LocalDate.of(2025, 9, 1));
        return request;
    }

    private static OrderRequest order(String profileId, String campaignId, String productId) {
        LineItemRequest item = new LineItemRequest();
        item.setProductId(productId);
        item.setQuantity(2);
        OrderRequest request = new OrderRequest();
        request.setProfileId(profileId);
        request.setCampaignId(campaignId);
        request.setCustomerName("Pat Neighbor");
        request.setPaymentMethod("Cash");
        request.setLineItems(List.of(item));
        return request;
    }
}
