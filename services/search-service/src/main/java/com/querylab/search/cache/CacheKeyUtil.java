package com.querylab.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class CacheKeyUtil {
    private CacheKeyUtil() {
    }

    /**
     * MD5 of the JSON form of {@code value}, truncated to {@code length} hex characters.
     * Returns {@code null} when the value cannot be serialized.
     */
    public static String hashJson(ObjectMapper mapper, Object value, int length) {
        try {
            String json = mapper.writeValueAsString(value);
            String hash = md5(json);
            return hash.substring(0, Math.min(length, hash.length()));
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static String sha256(String value) {
        return digest("SHA-256", value);
    }

    public static String md5(String value) {
        return digest("MD5", value);
    }

    private static String digest(String algorithm, String value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
