package com.pluginmarket.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO matching the source-control "release" webhook payload.
 * Boxed types so that absent fields stay null and can be reported.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReleaseEvent {

    private String action;

    private Release release;

    private Repository repository;

    /**
     * Names of the fields a published release must carry before a build can be
     * created from it. Empty when the payload is complete.
     */
    public List<String> missingPublishedFields() {
        List<String> missing = new ArrayList<>();
        if (release == null) {
            missing.add("release");
        } else {
            if (release.getId() == null) missing.add("release.id");
            if (isBlank(release.getTagName())) missing.add("release.tag_name");
            if (release.getDraft() == null) missing.add("release.draft");
            if (isBlank(release.getTarballUrl())) missing.add("release.tarball_url");
        }
        if (repository == null) {
            missing.add("repository");
        } else {
            if (repository.getId() == null) missing.add("repository.id");
            if (isBlank(repository.getFullName())) missing.add("repository.full_name");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Release {
        private Long id;

        @JsonProperty("tag_name")
        private String tagName;

        private String name;

        private String body;

        private Boolean draft;

        private Boolean prerelease;

        @JsonProperty("tarball_url")
        private String tarballUrl;

        public boolean isDraft() {
            return Boolean.TRUE.equals(draft);
        }

        public boolean isPrerelease() {
            return Boolean.TRUE.equals(prerelease);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Repository {
        private Long id;

        @JsonProperty("full_name")
        private String fullName;

        @JsonProperty("default_branch")
        private String defaultBranch;
    }
}
