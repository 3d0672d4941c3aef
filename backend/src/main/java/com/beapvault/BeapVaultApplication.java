package com.beapvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BeapVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(BeapVaultApplication.class, args);
    }
}
