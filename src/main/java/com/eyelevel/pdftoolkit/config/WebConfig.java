package com.eyelevel.pdftoolkit.config;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

/**
 * Web-related beans, including the CORS policy for the browser client.
 */
@Slf4j
@Configuration
public class WebConfig {

    @Value("${app.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    /**
     * Opens the operation and download endpoints to the configured client origins.
     * The browser client only needs to POST uploads and GET artifacts.
     *
     * @return a WebMvcConfigurer with the defined CORS mapping.
     */
    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(@NonNull CorsRegistry registry) {
                log.info("CORS allowed origins: {}", Arrays.toString(allowedOrigins));
                registry.addMapping("/api/**")
                        .allowedOrigins(allowedOrigins)
                        .allowedMethods("GET", "POST", "OPTIONS")
                        .allowedHeaders("*")
                        .maxAge(3600);
                registry.addMapping("/download/**")
                        .allowedOrigins(allowedOrigins)
                        .allowedMethods("GET")
                        .maxAge(3600);
            }
        };
    }
}
