package com.pluginmarket.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginmarket.pipeline.exception.MalformedPayloadException;
import com.pluginmarket.pipeline.model.ReleaseEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Sorts verified webhook deliveries into the few that should produce a build
 * and the many that are acknowledged and dropped. Dropped events still get a
 * 200 so the sender does not retry them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventClassifier {

    static final String PING = "ping";
    static final String RELEASE = "release";
    static final String PUBLISHED = "published";

    private final ObjectMapper objectMapper;

    public enum Disposition {
        PING,
        UNHANDLED_EVENT,
        UNHANDLED_ACTION,
        DRAFT,
        BUILD
    }

    public record ClassifiedEvent(Disposition disposition, ReleaseEvent payload) {

        public String action() {
            return payload != null ? payload.getAction() : null;
        }
    }

    /**
     * @throws MalformedPayloadException if a release delivery is not JSON or is
     *                                   missing fields needed to build it
     */
    public ClassifiedEvent classify(String eventType, byte[] rawBody) {
        // Ping is answered before parsing: its payload shape is irrelevant.
        if (PING.equals(eventType)) {
            return new ClassifiedEvent(Disposition.PING, null);
        }
        if (!RELEASE.equals(eventType)) {
            return new ClassifiedEvent(Disposition.UNHANDLED_EVENT, null);
        }

        ReleaseEvent payload = parse(rawBody);
        if (payload.getAction() == null || payload.getAction().isBlank()) {
            throw new MalformedPayloadException("Missing required field: action");
        }
        if (!PUBLISHED.equals(payload.getAction())) {
            log.info("Ignoring release action: {}", payload.getAction());
            return new ClassifiedEvent(Disposition.UNHANDLED_ACTION, payload);
        }

        List<String> missing = payload.missingPublishedFields();
        if (!missing.isEmpty()) {
            throw new MalformedPayloadException("Missing required fields: " + String.join(", ", missing));
        }

        if (payload.getRelease().isDraft()) {
            log.info("Ignoring draft release {}", payload.getRelease().getTagName());
            return new ClassifiedEvent(Disposition.DRAFT, payload);
        }
        return new ClassifiedEvent(Disposition.BUILD, payload);
    }

    private ReleaseEvent parse(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            throw new MalformedPayloadException("Invalid JSON payload");
        }
        try {
            ReleaseEvent payload = objectMapper.readValue(rawBody, ReleaseEvent.class);
            if (payload == null) {
                throw new MalformedPayloadException("Invalid JSON payload");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Invalid JSON payload", e);
        } catch (IOException e) {
            throw new MalformedPayloadException("Unreadable payload", e);
        }
    }
}
