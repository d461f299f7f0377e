package com.pluginmarket.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginmarket.pipeline.exception.MalformedPayloadException;
import com.pluginmarket.pipeline.service.EventClassifier.ClassifiedEvent;
import com.pluginmarket.pipeline.service.EventClassifier.Disposition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventClassifier")
class EventClassifierTest {

    private final EventClassifier classifier = new EventClassifier(new ObjectMapper());

    static String release(String action, boolean draft) {
        return """
                {
                  "action": "%s",
                  "release": {
                    "id": 9001,
                    "tag_name": "v2.1.0",
                    "name": "Second minor",
                    "body": "changes",
                    "draft": %s,
                    "prerelease": false,
                    "tarball_url": "https://api.example.com/repos/acme/demo/tarball/v2.1.0"
                  },
                  "repository": {"id": 555, "full_name": "acme/demo", "default_branch": "main"}
                }
                """.formatted(action, draft);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should acknowledge ping without looking at the payload")
    void pingIgnoresPayload() {
        assertThat(classifier.classify("ping", bytes("not json at all")).disposition())
                .isEqualTo(Disposition.PING);
        assertThat(classifier.classify("ping", new byte[0]).disposition())
                .isEqualTo(Disposition.PING);
    }

    @Test
    @DisplayName("Should ignore events other than release")
    void ignoresOtherEvents() {
        assertThat(classifier.classify("push", bytes("{}")).disposition())
                .isEqualTo(Disposition.UNHANDLED_EVENT);
        assertThat(classifier.classify("", bytes("{}")).disposition())
                .isEqualTo(Disposition.UNHANDLED_EVENT);
    }

    @Test
    @DisplayName("Should ignore release actions other than published")
    void ignoresOtherActions() {
        ClassifiedEvent classified = classifier.classify("release", bytes("{\"action\":\"edited\"}"));

        assertThat(classified.disposition()).isEqualTo(Disposition.UNHANDLED_ACTION);
        assertThat(classified.action()).isEqualTo("edited");
    }

    @Test
    @DisplayName("Should ignore draft releases")
    void ignoresDrafts() {
        assertThat(classifier.classify("release", bytes(release("published", true))).disposition())
                .isEqualTo(Disposition.DRAFT);
    }

    @Test
    @DisplayName("Should accept a published non-draft release with its payload")
    void acceptsPublished() {
        ClassifiedEvent classified = classifier.classify("release", bytes(release("published", false)));

        assertThat(classified.disposition()).isEqualTo(Disposition.BUILD);
        assertThat(classified.payload().getRelease().getTagName()).isEqualTo("v2.1.0");
        assertThat(classified.payload().getRelease().getTarballUrl()).endsWith("/tarball/v2.1.0");
        assertThat(classified.payload().getRepository().getId()).isEqualTo(555L);
    }

    @Test
    @DisplayName("Should reject release deliveries that are not JSON")
    void rejectsInvalidJson() {
        assertThatThrownBy(() -> classifier.classify("release", bytes("{broken")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessage("Invalid JSON payload");
        assertThatThrownBy(() -> classifier.classify("release", new byte[0]))
                .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> classifier.classify("release", bytes("null")))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("Should reject a release delivery without an action")
    void rejectsMissingAction() {
        assertThatThrownBy(() -> classifier.classify("release", bytes("{\"release\":{}}")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("action");
    }

    @Test
    @DisplayName("Should name every missing field of a published release")
    void rejectsIncompletePublishedRelease() {
        String payload = """
                {"action":"published","release":{"id":1,"draft":false},"repository":{"full_name":"acme/demo"}}
                """;

        assertThatThrownBy(() -> classifier.classify("release", bytes(payload)))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("release.tag_name")
                .hasMessageContaining("release.tarball_url")
                .hasMessageContaining("repository.id");
    }
}
