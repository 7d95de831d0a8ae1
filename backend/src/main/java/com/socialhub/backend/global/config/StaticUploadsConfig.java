package com.socialhub.backend.global.config;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves files published by the local object storage under {@code /static/**}.
 */
@Configuration
public class StaticUploadsConfig implements WebMvcConfigurer {

    private final String publicDir;

    public StaticUploadsConfig(@Value("${app.storage.public-dir:uploads/public}") String publicDir) {
        this.publicDir = publicDir;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        Path root = Paths.get(publicDir).toAbsolutePath().normalize();
        registry.addResourceHandler("/static/**")
                .addResourceLocations(root.toUri().toString())
                .setCachePeriod(3600);
    }
}
