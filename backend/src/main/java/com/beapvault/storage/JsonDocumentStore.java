package com.beapvault.storage;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON documents on top of a {@link KeyValueStore}.
 */
@Component
public class JsonDocumentStore {

    private final KeyValueStore store;
    private final ObjectMapper mapper;

    public JsonDocumentStore(KeyValueStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    public <T> Optional<T> read(String key, Class<T> type) {
        return store.get(key).map(json -> {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt document at key " + key, e);
            }
        });
    }

    public <T> Optional<T> read(String key, TypeReference<T> type) {
        return store.get(key).map(json -> {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt document at key " + key, e);
            }
        });
    }

    public void write(String key, Object value) {
        String json;
        try {
            json = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize document for key " + key, e);
        }
        store.set(key, json);
    }

    public void remove(String key) {
        store.remove(key);
    }
}
