package com.relaychat.core.model;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Derives store uniqueness keys from log events.
 * <p>
 * Correlation keys only carry the ingress millisecond, so two different messages accepted in the
 * same millisecond share one. The derived key appends a short SHA-256 digest of the text: a
 * redelivered event maps to the same key, distinct messages do not.
 * </p>
 * <p>
 * Deduplication is therefore per correlation key and text, not per correlation key alone: two
 * events sharing a correlation key but carrying different texts are stored as two rows.
 * </p>
 */
public final class UniqueKeys {
    private static final int DIGEST_HEX_CHARS = 16;

    private UniqueKeys() {
    }

    /**
     * @param correlationKey producer-assigned key, may be null
     * @param text           message text
     * @return {@code <correlationKey>:<16 hex chars>}, or null when there is no correlation key
     */
    public static String derive(String correlationKey, String text) {
        if (correlationKey == null) {
            return null;
        }
        String body = text == null ? "" : text;
        String digest = Hashing.sha256().hashString(body, StandardCharsets.UTF_8).toString();
        return correlationKey + ":" + digest.substring(0, DIGEST_HEX_CHARS);
    }
}
