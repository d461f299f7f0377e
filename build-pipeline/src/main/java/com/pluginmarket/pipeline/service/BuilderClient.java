package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.exception.BuilderDispatchException;
import com.pluginmarket.pipeline.model.BuildJob;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Thin client over the builder service's job endpoint.
 *
 * Acceptance is all we wait for; the builder reports progress later through
 * the build status callback. Transport failures and 5xx responses are retried
 * by Resilience4j (instance "builder"); a 4xx is passed through untouched and
 * fails the dispatch at once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BuilderClient {

    static final String SERVICE_KEY_HEADER = "X-Service-Key";

    private final RestTemplate restTemplate;
    private final PluginBuildsProperties properties;

    @Retry(name = "builder")
    public void dispatch(BuildJob job) {
        String baseUrl = properties.getBuilder().getUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Builder URL is not configured; build " + job.buildId() + " stays pending");
        }

        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/jobs")
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String serviceKey = properties.getBuilder().getServiceKey();
        if (serviceKey != null && !serviceKey.isBlank()) {
            headers.set(SERVICE_KEY_HEADER, serviceKey);
        }

        log.debug("Dispatching build {} to {}", job.buildId(), url);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(job, headers), Void.class);
            log.info("Builder accepted build {} for {}@{}", job.buildId(), job.pluginId(), job.version());
        } catch (HttpClientErrorException e) {
            // a rejected job fails the same way every time; not retried
            log.error("Builder refused build {} with {}: {}", job.buildId(), e.getStatusCode(), e.getMessage());
            throw e;
        } catch (RestClientException e) {
            log.warn("Builder rejected build {}: {}", job.buildId(), e.getMessage());
            throw new BuilderDispatchException("Could not dispatch build " + job.buildId(), e);
        }
    }
}
