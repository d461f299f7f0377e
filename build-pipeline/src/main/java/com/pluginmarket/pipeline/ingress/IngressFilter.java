package com.pluginmarket.pipeline.ingress;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginmarket.pipeline.config.PipelineConfig;
import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;

/**
 * Runs in front of every route: security headers, then per-IP rate limiting,
 * then CORS negotiation.
 *
 * A disallowed origin only fails preflight. Simple requests from it still go
 * through, just without CORS headers, so the browser blocks the read.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class IngressFilter extends OncePerRequestFilter {

    static final Map<String, String> SECURITY_HEADERS = Map.of(
            "X-Content-Type-Options", "nosniff",
            "X-Frame-Options", "DENY",
            "X-XSS-Protection", "1; mode=block",
            "Referrer-Policy", "strict-origin-when-cross-origin"
    );

    private final RateLimiter publicRateLimiter;
    private final RateLimiter apiRateLimiter;
    private final CorsPolicy corsPolicy;
    private final PluginBuildsProperties properties;
    private final ObjectMapper objectMapper;

    public IngressFilter(@Qualifier(PipelineConfig.PUBLIC_RATE_LIMITER) RateLimiter publicRateLimiter,
                         @Qualifier(PipelineConfig.API_RATE_LIMITER) RateLimiter apiRateLimiter,
                         CorsPolicy corsPolicy,
                         PluginBuildsProperties properties,
                         ObjectMapper objectMapper) {
        this.publicRateLimiter = publicRateLimiter;
        this.apiRateLimiter = apiRateLimiter;
        this.corsPolicy = corsPolicy;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        SECURITY_HEADERS.forEach(response::setHeader);

        // ── Rate limiting ────────────────────────────────────────────────────
        String ip = ClientAddress.resolve(request);
        RateLimiter limiter = limiterFor(request.getRequestURI());
        RateLimitDecision decision = limiter.tryAcquire(ip);

        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.limit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));

        if (!decision.allowed()) {
            log.warn("Rate limit '{}' exceeded for {} on {}", limiter.getName(), ip, request.getRequestURI());
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setHeader("Retry-After", String.valueOf(decision.retryAfterSeconds()));
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), Map.of(
                    "error", "Too many requests. Please try again later.",
                    "code", "RATE_LIMITED"));
            return;
        }

        // ── CORS ─────────────────────────────────────────────────────────────
        String origin = request.getHeader("Origin");
        boolean originAllowed = corsPolicy.isAllowed(origin);

        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            if (originAllowed) {
                corsPolicy.headersFor(origin != null ? origin : "*").forEach(response::setHeader);
                response.setStatus(HttpStatus.NO_CONTENT.value());
            } else {
                log.debug("Rejected preflight from origin {}", origin);
                response.setStatus(HttpStatus.FORBIDDEN.value());
            }
            return;
        }

        if (originAllowed && origin != null) {
            corsPolicy.headersFor(origin).forEach(response::setHeader);
        }

        chain.doFilter(request, response);
    }

    private RateLimiter limiterFor(String path) {
        boolean api = properties.getRateLimit().getApiPathPrefixes().stream()
                .anyMatch(path::startsWith);
        return api ? apiRateLimiter : publicRateLimiter;
    }
}
