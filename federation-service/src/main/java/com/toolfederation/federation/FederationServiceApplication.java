package com.toolfederation.federation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FederationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FederationServiceApplication.class, args);
    }
}
