package com.al.reportmigrator.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document for the conversion endpoints.
 * Swagger UI: /swagger-ui.html, JSON: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:ReportMigrator}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Migrates report definitions between reporting platforms.

                                                                ## Features
                                                                - **Formula Translation**: source formula language to procedural SQL functions
                                                                - **Layout Synthesis**: flat section lists to nested frame trees
                                                                - **Format Triggers**: suppress and conditional-format rules as boolean functions
                                                                - **Batch Operations**: parallel conversion of many report definitions
                                                                """)
                                                .contact(new Contact()
                                                                .name("Report Migrator Team")
                                                                .email("support@example.com")))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Conversion")
                                                                .description("Report and expression conversion endpoints")));
        }
}
