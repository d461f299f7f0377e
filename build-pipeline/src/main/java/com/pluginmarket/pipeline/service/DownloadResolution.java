package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.model.Artifact;
import com.pluginmarket.pipeline.model.BuildRecord;
import org.springframework.http.HttpStatus;

/**
 * Outcome of a download lookup: either an artifact, or a code telling the
 * client whether to poll, give up, or report a server problem.
 */
public record DownloadResolution(Outcome outcome, Artifact artifact, BuildRecord build) {

    public enum Outcome {
        FOUND(HttpStatus.OK, null),
        PLUGIN_NOT_FOUND(HttpStatus.NOT_FOUND, "Plugin not found"),
        NO_VERSION(HttpStatus.NOT_FOUND,
                "No published version available. Developer needs to create a release."),
        BUILDING(HttpStatus.ACCEPTED, "Plugin is currently building. Try again in a few minutes."),
        BUILD_FAILED(HttpStatus.NOT_FOUND, "Latest build failed. Developer needs to fix and release again."),
        DOWNLOAD_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "Download URL unavailable");

        private final HttpStatus httpStatus;
        private final String message;

        Outcome(HttpStatus httpStatus, String message) {
            this.httpStatus = httpStatus;
            this.message = message;
        }

        public HttpStatus httpStatus() {
            return httpStatus;
        }

        public String message() {
            return message;
        }
    }

    static DownloadResolution found(Artifact artifact) {
        return new DownloadResolution(Outcome.FOUND, artifact, null);
    }

    static DownloadResolution of(Outcome outcome) {
        return new DownloadResolution(outcome, null, null);
    }

    static DownloadResolution of(Outcome outcome, BuildRecord build) {
        return new DownloadResolution(outcome, null, build);
    }
}
