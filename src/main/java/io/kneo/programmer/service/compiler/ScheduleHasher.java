package io.kneo.programmer.service.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.kneo.programmer.service.exceptions.CompileError;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

public final class ScheduleHasher {
    public static final String PREFIX = "sha256:";
    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ScheduleHasher() {
    }

    public static String hash(Map<String, Object> hashable) {
        try {
            byte[] json = CANONICAL.writeValueAsBytes(hashable);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return PREFIX + HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new CompileError("Failed to hash schedule", e);
        }
    }
}
