package com.example.audiobookfinder.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI audiobookFinderOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Audiobook Finder API")
                        .description("Book library scanning, YouTube audiobook search and MP3 download tracking")
                        .version("v1")
                        .contact(new Contact().name("audiobook-finder")));
    }
}
