package com.talentscope.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Hex SHA-256 digests used as cache key suffixes. */
public final class CacheKeyUtil {
    private static final HexFormat HEX = HexFormat.of();

    private CacheKeyUtil() {
    }

    /** Digest of the JSON form of {@code value}; callers must pass a canonical, ordered structure. */
    public static String hashJson(ObjectMapper mapper, Object value) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cache key payload is not serializable", e);
        }
        return digest(json);
    }

    public static String sha256(String value) {
        return value == null ? null : digest(value.getBytes(StandardCharsets.UTF_8));
    }

    private static String digest(byte[] bytes) {
        MessageDigest sha;
        try {
            sha = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        return HEX.formatHex(sha.digest(bytes));
    }
}
