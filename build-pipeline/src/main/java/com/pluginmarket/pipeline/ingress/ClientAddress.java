package com.pluginmarket.pipeline.ingress;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the caller's IP behind a proxy: first X-Forwarded-For hop,
 * then X-Real-Ip, then the socket address.
 */
public final class ClientAddress {

    private ClientAddress() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.getHeader("X-Real-Ip");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        return remote != null ? remote : "unknown";
    }
}
