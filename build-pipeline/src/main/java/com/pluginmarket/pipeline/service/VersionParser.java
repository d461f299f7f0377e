package com.pluginmarket.pipeline.service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a release tag into a version string.
 *
 * <pre>
 *   v1.2.3               → 1.2.3
 *   release-1.2.3        → 1.2.3
 *   release/2.0.0-beta.1 → 2.0.0
 *   nightly-build        → nightly-build
 * </pre>
 *
 * Tags that are not semver are passed through cleaned but otherwise unchanged.
 */
public final class VersionParser {

    private static final Pattern LEADING_V = Pattern.compile("^v", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELEASE_PREFIX = Pattern.compile("^release[-/]", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEMVER_PREFIX = Pattern.compile("^(\\d+\\.\\d+\\.\\d+)");

    private VersionParser() {
    }

    public static String parseVersion(String tag) {
        String cleaned = LEADING_V.matcher(tag).replaceFirst("");
        cleaned = RELEASE_PREFIX.matcher(cleaned).replaceFirst("");

        Matcher semver = SEMVER_PREFIX.matcher(cleaned);
        return semver.find() ? semver.group(1) : cleaned;
    }
}
