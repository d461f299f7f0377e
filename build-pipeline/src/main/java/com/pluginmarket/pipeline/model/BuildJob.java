package com.pluginmarket.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Job description sent to the builder service.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BuildJob(
        String buildId,
        String pluginId,
        String version,
        String tarballUrl,
        String releaseTag,
        String changelog,
        boolean prerelease,
        String pluginPath) {

    public static BuildJob from(BuildRecord build) {
        return new BuildJob(
                build.getId(),
                build.getPluginId(),
                build.getVersion(),
                build.getSourceArchiveUrl(),
                build.getSourceTag(),
                build.getChangelog(),
                build.isPrerelease(),
                build.getPluginSubpath());
    }
}
