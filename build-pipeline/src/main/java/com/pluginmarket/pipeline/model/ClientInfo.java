package com.pluginmarket.pipeline.model;

/**
 * Who asked for a download, as far as the request headers tell.
 */
public record ClientInfo(String requesterId, String ip, String userAgent) {
}
