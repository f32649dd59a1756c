package com.rentdesk.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI rentDeskOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("RentDesk API")
                        .description("Rent collection back office: tenants, unit bindings, rent payments and the daily rent cycle.")
                        .version("v1")
                        .contact(new Contact()
                                .name("RentDesk")
                                .email("support@rentdesk.app")
                        )
                );
    }
}
