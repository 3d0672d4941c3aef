package com.beapvault.crypto;

import java.nio.charset.StandardCharsets;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * SHA-256 hashing for every integrity binding in the vault: audit event hashes,
 * export hashes, archive references and tool output hashes.
 *
 * <p>Structured values are hashed over their <em>canonical</em> JSON form: properties
 * sorted alphabetically, map entries sorted by key, null fields omitted. Two
 * structurally equal values therefore always hash identically, no matter which
 * process built them or in what order their fields were populated.
 *
 * <p>This mapper is deliberately separate from the application {@link ObjectMapper}
 * so that web-layer Jackson customisation can never change a hash.
 */
@Component
public class ContentHasher {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    /** Lower-case hex SHA-256 of the UTF-8 bytes of {@code data}. */
    public String sha256(String data) {
        return sha256(data.getBytes(StandardCharsets.UTF_8));
    }

    public String sha256(byte[] data) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    public String canonicalJson(Object value) {
        try {
            return canonicalMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value for hashing", e);
        }
    }

    /** SHA-256 of the canonical JSON form of {@code value}. */
    public String hashOf(Object value) {
        return sha256(canonicalJson(value));
    }
}
