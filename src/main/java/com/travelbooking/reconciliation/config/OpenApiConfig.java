package com.travelbooking.reconciliation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI bookingPaymentOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Booking Payment Reconciliation API")
                        .description("Initiates Chapa payments for travel bookings and reconciles payment and booking status from gateway webhooks, manual verification and scheduled re-verification.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Travel Payments Team")
                                .email("support@alxtravel.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
