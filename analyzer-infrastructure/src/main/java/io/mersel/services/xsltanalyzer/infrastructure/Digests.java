package io.mersel.services.xsltanalyzer.infrastructure;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 tabanlı içerik özetleri.
 */
final class Digests {

    private static final int SHORT_HASH_LENGTH = 16;

    private Digests() {
    }

    static String sha256Hex(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algoritması bulunamadı", e);
        }
    }

    /** Değişiklik tespiti için kısa özet: SHA-256'nın ilk 16 hex karakteri. */
    static String contentHash(String text) {
        return sha256Hex(text).substring(0, SHORT_HASH_LENGTH);
    }
}
