package com.beapvault.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

class JsonDocumentStoreTest {

    private InMemoryKeyValueStore store;
    private JsonDocumentStore documents;

    record Note(String title, int priority) {
    }

    @BeforeEach
    void setup() {
        store = new InMemoryKeyValueStore();
        documents = new JsonDocumentStore(store, new ObjectMapper());
    }

    @Test
    void write_shouldStoreJsonReadableByType() {
        documents.write("notes:1", new Note("archive", 2));

        assertEquals(new Note("archive", 2), documents.read("notes:1", Note.class).orElseThrow());
        assertEquals("{\"title\":\"archive\",\"priority\":2}", store.get("notes:1").orElseThrow());
    }

    @Test
    void read_shouldSupportGenericTypes() {
        documents.write("notes:list", List.of(new Note("a", 1), new Note("b", 2)));

        List<Note> notes = documents.read("notes:list", new TypeReference<List<Note>>() {}).orElseThrow();
        assertEquals(2, notes.size());
        assertEquals("b", notes.get(1).title());
    }

    @Test
    void read_missingKey_shouldBeEmpty() {
        assertTrue(documents.read("nothing", Note.class).isEmpty());
    }

    @Test
    void read_corruptDocument_shouldFailLoudly() {
        store.set("notes:bad", "{not json");

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> documents.read("notes:bad", Note.class));
        assertTrue(e.getMessage().contains("notes:bad"));
    }

    @Test
    void remove_shouldDeleteDocument() {
        documents.write("notes:1", new Note("archive", 2));

        documents.remove("notes:1");

        assertTrue(store.get("notes:1").isEmpty());
    }
}
