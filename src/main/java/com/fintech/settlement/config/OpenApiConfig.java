package com.fintech.settlement.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI commissionSettlementOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Commission Settlement Service API")
                        .description("REST API for generating daily payment settlements, paying delegate and coordinator commissions through the payout gateway and transferring the SHA and MWU shares to their bank accounts.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Settlement Operations")
                                .email("settlements@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
