package com.adlanda.dailytoon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Origins allowed to call the /api endpoints from a browser.
 *
 * Registered by {@link CorsConfig} so it is available wherever the MVC configuration is.
 */
@ConfigurationProperties(prefix = "dailytoon.cors")
public class CorsProperties {

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }
}
