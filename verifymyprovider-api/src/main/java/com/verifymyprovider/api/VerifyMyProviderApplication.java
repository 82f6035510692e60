package com.verifymyprovider.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * VerifyMyProvider trust core.
 *
 * Confidence scoring, crowdsourced consensus, TTL lifecycle and import
 * conflict handling for provider/plan acceptance data.
 */
@SpringBootApplication(scanBasePackages = "com.verifymyprovider")
@EntityScan(basePackages = "com.verifymyprovider.core.domain")
@EnableJpaRepositories(basePackages = "com.verifymyprovider.core.repository")
@ConfigurationPropertiesScan(basePackages = "com.verifymyprovider.api.config")
public class VerifyMyProviderApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerifyMyProviderApplication.class, args);
    }
}
