package com.example.tuckshop.infrastructure.config;

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
    public OpenAPI tuckShopOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tuck Shop Order Service API")
                        .description("""
                                Orders and inventory for the tuck shop.

                                ## Caller identity

                                Every request carries `X-User-Id` and `X-User-Role`
                                (`customer`, `employee` or `owner`).

                                ## Stock consistency

                                - Placing an order deducts stock for all lines together or not at all
                                - Cancelling a pending or in-progress order puts its stock back exactly once
                                - Prices and totals are always taken from inventory, never from the client
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Tuck Shop Team")
                                .email("tuckshop@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
