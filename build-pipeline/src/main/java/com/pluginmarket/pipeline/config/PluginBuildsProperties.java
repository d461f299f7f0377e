package com.pluginmarket.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "plugin-builds")
@Data
public class PluginBuildsProperties {

    private Webhook webhook = new Webhook();
    private RateLimit rateLimit = new RateLimit();
    private Cors cors = new Cors();
    private Builder builder = new Builder();
    private Reaper reaper = new Reaper();
    private Telemetry telemetry = new Telemetry();
    private Tasks tasks = new Tasks();

    @Data
    public static class Webhook {
        /** Shared HMAC secret; unset means every delivery is rejected */
        private String secret;
    }

    @Data
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(60);
        private int publicLimit = 100;
        private int apiLimit = 200;
        /** Path prefixes served under the higher API ceiling */
        private List<String> apiPathPrefixes = new ArrayList<>(List.of("/webhooks/", "/builds/"));
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Cors {
        /** Production web origins */
        private List<String> allowedOrigins = new ArrayList<>();
        /** Origins used by the desktop client's webview on the various platforms */
        private List<String> desktopOrigins = new ArrayList<>(List.of(
                "tauri://localhost", "https://tauri.localhost", "http://tauri.localhost", "null"));
        private List<String> desktopSchemes = new ArrayList<>(List.of("tauri://"));
        /** Also allow any http://localhost origin */
        private boolean developmentMode = false;
        private String allowedMethods = "GET, POST, PUT, PATCH, DELETE, OPTIONS";
        private String allowedHeaders = "Content-Type, Authorization, X-User-Id, X-Requested-With, X-Service-Key";
        private Duration maxAge = Duration.ofDays(1);
    }

    @Data
    public static class Builder {
        private String url;
        /** Shared key for builder → pipeline status callbacks */
        private String serviceKey;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Reaper {
        private boolean enabled = true;
        /** Pending/building records older than this are failed */
        private Duration stuckTimeout = Duration.ofMinutes(30);
        private Duration interval = Duration.ofMinutes(5);
    }

    @Data
    public static class Telemetry {
        private TelemetryMode mode = TelemetryMode.JDBC;
        private Csv csv = new Csv();
        /** Same IP hash + version inside this window counts once */
        private Duration duplicateWindow = Duration.ofHours(24);

        @Data
        public static class Csv {
            private String outputDir = "./data/telemetry";
            private boolean includeHeader = true;
        }

        public enum TelemetryMode {
            JDBC, CSV, BOTH
        }
    }

    @Data
    public static class Tasks {
        private int poolSize = 4;
        private int queueCapacity = 500;
    }
}
