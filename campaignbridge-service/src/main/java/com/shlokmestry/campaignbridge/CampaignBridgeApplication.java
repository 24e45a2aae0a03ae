package com.shlokmestry.campaignbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CampaignBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignBridgeApplication.class, args);
    }
}
