package com.clinic.scheduling.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI schedulingOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Clinic Scheduling API")
                .description("REST API for the clinic resource and procedure scheduling engine: "
                    + "resource catalog, procedures, availability, slot generation and "
                    + "conflict-safe appointment booking. Tenant-scoped calls take the "
                    + "X-Tenant-Id header.")
                .version("1.0.0"));
    }
}
