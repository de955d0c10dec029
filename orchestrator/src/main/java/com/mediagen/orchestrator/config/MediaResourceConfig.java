package com.mediagen.orchestrator.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves stored artifacts from the storage directory, so the result URL
 * recorded on a completed job resolves.
 */
@Configuration
public class MediaResourceConfig implements WebMvcConfigurer {

    private final StorageProperties properties;

    public MediaResourceConfig(StorageProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String prefix = properties.getPublicPath().endsWith("/")
                ? properties.getPublicPath()
                : properties.getPublicPath() + "/";
        String location = properties.getBasePath().toAbsolutePath().normalize().toUri().toString();
        if (!location.endsWith("/")) {
            location += "/";
        }
        registry.addResourceHandler(prefix + "**").addResourceLocations(location);
    }
}
