package com.hrsearch.employeesearch.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for the search endpoints.
 *
 * <p>Lets a locally served directory front end (Vite on localhost:5173 or CRA on localhost:3000)
 * call the search API during development. The endpoints are read-only, so only GET is allowed.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        for (String mapping : new String[] {"/api/**", "/search"}) {
            registry.addMapping(mapping)
                    .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                    .allowedMethods("GET", "OPTIONS")
                    .allowedHeaders("*")
                    .exposedHeaders("X-Correlation-ID", "Retry-After")
                    .maxAge(3600);
        }
    }
}
