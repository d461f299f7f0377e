package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.exception.BuilderDispatchException;
import com.pluginmarket.pipeline.model.BuildJob;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("BuilderClient")
class BuilderClientTest {

    private static final BuildJob JOB = new BuildJob(
            "build-1", "demo-plugin", "2.1.0",
            "https://api.example.com/repos/acme/demo/tarball/v2.1.0",
            "v2.1.0", "- faster", false, "packages/demo");

    private MockRestServiceServer server;
    private PluginBuildsProperties properties;
    private BuilderClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new PluginBuildsProperties();
        properties.getBuilder().setUrl("http://builder.internal:8080");
        properties.getBuilder().setServiceKey("svc-key");
        client = new BuilderClient(restTemplate, properties);
    }

    @Test
    @DisplayName("Should post the job with the service key")
    void postsJob() {
        server.expect(requestTo("http://builder.internal:8080/jobs"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Service-Key", "svc-key"))
                .andExpect(jsonPath("$.buildId").value("build-1"))
                .andExpect(jsonPath("$.version").value("2.1.0"))
                .andExpect(jsonPath("$.pluginPath").value("packages/demo"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        client.dispatch(JOB);

        server.verify();
    }

    @Test
    @DisplayName("Should wrap a server error so it can be retried")
    void wrapsServerError() {
        server.expect(requestTo("http://builder.internal:8080/jobs"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.dispatch(JOB))
                .isInstanceOf(BuilderDispatchException.class)
                .hasMessageContaining("build-1");
    }

    @Test
    @DisplayName("Should pass a rejected job through unwrapped so it is not retried")
    void rejectedJobIsNotRetryable() {
        server.expect(requestTo("http://builder.internal:8080/jobs"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertThatThrownBy(() -> client.dispatch(JOB))
                .isInstanceOf(HttpClientErrorException.class)
                .isNotInstanceOf(BuilderDispatchException.class);
    }

    @Test
    @DisplayName("Should refuse to dispatch without a builder URL")
    void requiresUrl() {
        properties.getBuilder().setUrl(" ");

        assertThatThrownBy(() -> client.dispatch(JOB))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("stays pending");
    }

    @Nested
    @DisplayName("Under the builder retry policy")
    class WithRetry {

        private Runnable dispatchWithRetry() {
            Retry retry = Retry.of("builder", RetryConfig.custom()
                    .maxAttempts(3)
                    .waitDuration(Duration.ofMillis(1))
                    .retryExceptions(BuilderDispatchException.class)
                    .build());
            return Retry.decorateRunnable(retry, () -> client.dispatch(JOB));
        }

        @Test
        @DisplayName("Should try a server error three times")
        void retriesServerError() {
            server.expect(ExpectedCount.times(3), requestTo("http://builder.internal:8080/jobs"))
                    .andRespond(withServerError());

            assertThatThrownBy(() -> dispatchWithRetry().run()).isInstanceOf(BuilderDispatchException.class);
            server.verify();
        }

        @Test
        @DisplayName("Should send a rejected job only once")
        void doesNotRetryRejection() {
            server.expect(ExpectedCount.once(), requestTo("http://builder.internal:8080/jobs"))
                    .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

            assertThatThrownBy(() -> dispatchWithRetry().run()).isInstanceOf(HttpClientErrorException.class);
            server.verify();
        }
    }
}
