package com.pluginmarket.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress report posted back by the builder service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BuildStatusUpdate {

    private String pluginId;
    private BuildStatus status;
    private String errorMessage;

    /** Present on success: where the packaged plugin was uploaded */
    private ArtifactUpload artifact;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArtifactUpload {
        private String downloadUrl;
        private String checksum;
        private Long fileSize;
    }
}
