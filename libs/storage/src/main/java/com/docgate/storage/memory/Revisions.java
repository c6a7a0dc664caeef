package com.docgate.storage.memory;

import com.docgate.model.error.InvalidRequestException;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Revision strings of the form {@code N-<md5>}, where N is the generation. The digest covers
 * the previous revision and the new content, so identical edit histories produce identical
 * revisions.
 */
final class Revisions {

    private Revisions() {
        // utility class
    }

    static String next(String previous, JsonNode content) {
        long generation = previous == null ? 1 : generation(previous) + 1;
        MessageDigest md5 = md5();
        if (previous != null) {
            md5.update(previous.getBytes(StandardCharsets.UTF_8));
        }
        md5.update(content.toString().getBytes(StandardCharsets.UTF_8));
        return generation + "-" + HexFormat.of().formatHex(md5.digest());
    }

    static long generation(String rev) {
        int dash = rev.indexOf('-');
        try {
            return Long.parseLong(dash > 0 ? rev.substring(0, dash) : rev);
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Invalid rev format: " + rev);
        }
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
