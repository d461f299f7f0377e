package com.pluginmarket.pipeline.config;

import com.pluginmarket.pipeline.exception.MalformedPayloadException;
import com.pluginmarket.pipeline.model.BuildRecord;
import com.pluginmarket.pipeline.service.BackgroundTaskRunner;
import com.pluginmarket.pipeline.service.EventClassifier;
import com.pluginmarket.pipeline.service.EventClassifier.ClassifiedEvent;
import com.pluginmarket.pipeline.service.ReleaseWebhookService;
import com.pluginmarket.pipeline.service.SignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@Slf4j
@RequiredArgsConstructor
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
    static final String EVENT_HEADER = "X-GitHub-Event";
    static final String DELIVERY_HEADER = "X-GitHub-Delivery";

    private final SignatureVerifier signatureVerifier;
    private final EventClassifier eventClassifier;
    private final ReleaseWebhookService releaseWebhookService;
    private final BackgroundTaskRunner backgroundTasks;

    // ── Health ───────────────────────────────────────────────────────────────

    @GetMapping("/webhooks/release")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "message", "Release webhook endpoint is active",
                "configured", signatureVerifier.isConfigured(),
                "backgroundTasks", backgroundTasks.stats()
        ));
    }

    // ── Deliveries ───────────────────────────────────────────────────────────

    /**
     * Receive a release webhook.
     *
     * Signature first, then classification. Everything the pipeline chooses to
     * ignore is still a 200 so the sender does not keep redelivering it.
     */
    @PostMapping("/webhooks/release")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = EVENT_HEADER, required = false) String eventType,
            @RequestHeader(value = DELIVERY_HEADER, required = false) String deliveryId) {

        byte[] body = rawBody != null ? rawBody : new byte[0];

        if (!signatureVerifier.verify(body, signature)) {
            log.error("Invalid webhook signature for delivery {}", deliveryId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "Invalid signature", "code", "INVALID_SIGNATURE"));
        }

        String event = eventType != null ? eventType : "";
        log.info("Received webhook: {} ({})", event, deliveryId);

        try {
            ClassifiedEvent classified = eventClassifier.classify(event, body);

            return switch (classified.disposition()) {
                case PING -> ResponseEntity.ok(Map.of("message", "pong"));
                case UNHANDLED_EVENT -> ResponseEntity.ok(Map.of(
                        "message", "Event type not handled", "event", event));
                case UNHANDLED_ACTION -> ResponseEntity.ok(Map.of(
                        "message", "Release action not handled", "action", classified.action()));
                case DRAFT -> ResponseEntity.ok(Map.of("message", "Draft releases are ignored"));
                case BUILD -> createBuild(classified, deliveryId);
            };

        } catch (MalformedPayloadException e) {
            log.warn("Rejected malformed delivery {}: {}", deliveryId, e.getMessage());
            return ResponseEntity.badRequest()
                    .body(Map.of("error", e.getMessage(), "code", "MALFORMED_PAYLOAD"));
        } catch (Exception e) {
            log.error("Error processing webhook delivery {}: {}", deliveryId, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Internal server error", "code", "INTERNAL_ERROR"));
        }
    }

    private ResponseEntity<Map<String, Object>> createBuild(ClassifiedEvent classified, String deliveryId) {
        Optional<BuildRecord> build = releaseWebhookService.handlePublishedRelease(classified.payload(), deliveryId);

        if (build.isEmpty()) {
            return ResponseEntity.ok(Map.of(
                    "message", "No plugin associated with this repository",
                    "repositoryId", classified.payload().getRepository().getId()));
        }

        return ResponseEntity.ok(Map.of(
                "message", "Build triggered",
                "buildId", build.get().getId(),
                "pluginId", build.get().getPluginId(),
                "version", build.get().getVersion()));
    }
}
