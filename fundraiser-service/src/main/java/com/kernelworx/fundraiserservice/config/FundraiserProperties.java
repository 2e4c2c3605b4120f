package com.kernelworx.fundraiserservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables under the {@code fundraiser} prefix.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fundraiser")
public class FundraiserProperties {

    @Valid
    private Invites invites = new Invites();

    @Valid
    private SharedCampaigns sharedCampaigns = new SharedCampaigns();

    @Valid
    private PaymentMethods paymentMethods = new PaymentMethods();

    @Getter
    @Setter
    public static class Invites {

        @Min(1)
        @Max(365)
        private int expiryDays = 14;

        @Min(6)
        @Max(32)
        private int codeLength = 10;
    }

    @Getter
    @Setter
    public static class SharedCampaigns {

        @Min(1)
        private int maxPerCreator = 50;
    }

    @Getter
    @Setter
    public static class PaymentMethods {

        @Min(1)
        @Max(255)
        private int maxNameLength = 50;
    }
}
