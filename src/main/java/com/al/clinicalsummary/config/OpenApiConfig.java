package com.al.clinicalsummary.config;

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
 * Swagger UI at /swagger-ui.html, OpenAPI JSON at /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:ClinicalSummaryExtractor}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Extracts structured clinical and hospital admission summaries from free-text notes.

                                                                ## Processing
                                                                - Eleven entity extractors run in parallel per note, each with its own timeout
                                                                - Clinical and hospital summaries are stored independently, keyed by hospitalization id
                                                                - Sync, batch and queue-based async submission
                                                                """)
                                                .contact(new Contact()
                                                                .name("Clinical Summary Team")
                                                                .email("support@example.com")))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Extraction")
                                                                .description("Submit notes and cancel in-flight processing"),
                                                new Tag().name("Summaries")
                                                                .description("Read and delete stored summaries")));
        }
}
