package com.kernelworx.fundraiserservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = {"com.kernelworx.fundraiserservice", "com.kernelworx.common"})
@ConfigurationPropertiesScan
public class FundraiserServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundraiserServiceApplication.class, args);
    }
}
