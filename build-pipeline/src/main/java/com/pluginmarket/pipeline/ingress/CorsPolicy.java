package com.pluginmarket.pipeline.ingress;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides which cross-origin callers may read responses: configured web
 * origins, the desktop client's webview origins, and localhost in
 * development mode. Requests without an Origin header are same-origin.
 */
@Component
@RequiredArgsConstructor
public class CorsPolicy {

    private static final String LOCALHOST_PREFIX = "http://localhost";

    private final PluginBuildsProperties properties;

    public boolean isAllowed(String origin) {
        if (origin == null) {
            return true;
        }
        PluginBuildsProperties.Cors cors = properties.getCors();

        if (cors.getDesktopOrigins().contains(origin)) {
            return true;
        }
        if (cors.getDesktopSchemes().stream().anyMatch(origin::startsWith)) {
            return true;
        }
        if (cors.isDevelopmentMode() && origin.startsWith(LOCALHOST_PREFIX)) {
            return true;
        }
        return cors.getAllowedOrigins().stream()
                .filter(allowed -> allowed != null && !allowed.isBlank())
                .anyMatch(origin::equals);
    }

    public Map<String, String> headersFor(String origin) {
        PluginBuildsProperties.Cors cors = properties.getCors();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Access-Control-Allow-Origin", origin);
        headers.put("Access-Control-Allow-Methods", cors.getAllowedMethods());
        headers.put("Access-Control-Allow-Headers", cors.getAllowedHeaders());
        headers.put("Access-Control-Allow-Credentials", "true");
        headers.put("Access-Control-Max-Age", String.valueOf(cors.getMaxAge().toSeconds()));
        return headers;
    }
}
