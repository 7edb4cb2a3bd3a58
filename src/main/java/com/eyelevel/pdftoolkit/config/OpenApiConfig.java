package com.eyelevel.pdftoolkit.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("PDF Toolkit API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Synchronous PDF processing for submission-ready documents.
                                Every operation accepts multipart uploads and answers with a short-lived
                                download reference served by `/download/{filename}`.

                                Key features include:
                                * **Compression:** Ghostscript preset search towards a target size, with an in-process fallback.
                                * **Page tools:** merge, split, organise and rotate.
                                * **Conversion:** images to PDF and PDF to Word (LibreOffice).
                                * **Hygiene:** metadata rewriting, submission renaming and pre-flight validation.

                                **Note:** Generated files are deleted automatically a few minutes after creation.
                                """));
    }
}
