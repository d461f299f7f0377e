package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the {@code sha256=<hex>} HMAC signature that accompanies each
 * webhook delivery. Never throws; any problem is a failed verification.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final PluginBuildsProperties properties;

    public boolean isConfigured() {
        String secret = properties.getWebhook().getSecret();
        return secret != null && !secret.isBlank();
    }

    public boolean verify(byte[] rawBody, String signatureHeader) {
        if (!isConfigured() || signatureHeader == null) {
            return false;
        }
        try {
            byte[] expected = sign(rawBody).getBytes(StandardCharsets.UTF_8);
            byte[] provided = signatureHeader.getBytes(StandardCharsets.UTF_8);
            // constant time for equal lengths, false on any length mismatch
            return MessageDigest.isEqual(expected, provided);
        } catch (GeneralSecurityException e) {
            log.error("Could not compute webhook signature: {}", e.getMessage());
            return false;
        }
    }

    private String sign(byte[] rawBody) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(properties.getWebhook().getSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
        byte[] digest = mac.doFinal(rawBody != null ? rawBody : new byte[0]);
        return PREFIX + HexFormat.of().formatHex(digest);
    }
}
