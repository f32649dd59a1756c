package com.rentdesk.backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class WhatsAppStartupValidation implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppStartupValidation.class);

    private final Environment environment;
    private final WhatsAppProperties properties;

    public WhatsAppStartupValidation(Environment environment, WhatsAppProperties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String[] profiles = environment.getActiveProfiles();
        log.info("Active profiles: {}", profiles.length == 0 ? "(default)" : String.join(",", profiles));

        if (!properties.enabled()) {
            log.info("WhatsApp disabled (rentdesk.whatsapp.enabled=false). Rent notifications will be recorded as failed.");
            return;
        }

        boolean phoneConfigured = properties.phoneNumberId() != null && !properties.phoneNumberId().isBlank();
        boolean tokenConfigured = properties.accessToken() != null && !properties.accessToken().isBlank();

        if (!phoneConfigured || !tokenConfigured) {
            log.warn(
                    "WhatsApp enabled but configuration is incomplete: phoneNumberIdConfigured={}, accessTokenConfigured={}, requireConfigOnStartup={}",
                    phoneConfigured,
                    tokenConfigured,
                    properties.requireConfigOnStartup()
            );
        }

        if (!properties.requireConfigOnStartup()) {
            return;
        }

        if (!phoneConfigured) {
            throw new IllegalStateException(
                    "WhatsApp is enabled but rentdesk.whatsapp.phone-number-id is blank. Set WHATSAPP_PHONE_NUMBER_ID or set WHATSAPP_REQUIRE_CONFIG_ON_STARTUP=false."
            );
        }

        if (!tokenConfigured) {
            throw new IllegalStateException(
                    "WhatsApp is enabled but the access token is missing. Set WHATSAPP_ACCESS_TOKEN or set WHATSAPP_REQUIRE_CONFIG_ON_STARTUP=false."
            );
        }
    }
}
