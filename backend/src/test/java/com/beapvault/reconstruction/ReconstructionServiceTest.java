package com.beapvault.reconstruction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.beapvault.BeapTestFixtures;
import com.beapvault.audit.AuditEvent;
import com.beapvault.audit.AuditEventType;
import com.beapvault.audit.AuditLedger;
import com.beapvault.crypto.ContentHasher;
import com.beapvault.evaluation.VerificationStatus;
import com.beapvault.message.BeapFolder;
import com.beapvault.message.InMemoryBeapMessageStore;
import com.beapvault.message.MessageNotFoundException;
import com.beapvault.storage.InMemoryKeyValueStore;
import com.beapvault.storage.JsonDocumentStore;
import com.beapvault.tools.ToolOperation;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class ReconstructionServiceTest {

    @Mock
    private ToolExecutor toolExecutor;

    private final ContentHasher hasher = BeapTestFixtures.hasher();
    private ExecutorService workers;
    private InMemoryBeapMessageStore messages;
    private AuditLedger ledger;
    private ReconstructionRecordStore records;
    private JsonDocumentStore documents;
    private ReconstructionService service;

    @BeforeEach
    void setup() {
        workers = Executors.newFixedThreadPool(2);
        messages = new InMemoryBeapMessageStore();
        documents = BeapTestFixtures.documents(new InMemoryKeyValueStore());
        ledger = new AuditLedger(documents, hasher, BeapTestFixtures.fixedClock());
        records = new ReconstructionRecordStore(documents);
        ReconstructionPipeline pipeline = new ReconstructionPipeline(BeapTestFixtures.readyToolRegistry(),
                toolExecutor, hasher, new ObjectMapper(), workers, Duration.ofSeconds(2), 256,
                BeapTestFixtures.fixedClock());
        service = new ReconstructionService(messages, pipeline, records, ledger, hasher,
                BeapTestFixtures.fixedClock());
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void reconstruct_shouldRecordStartedAndCompletedEvents() {
        messages.save(BeapTestFixtures.message("m1", VerificationStatus.ACCEPTED,
                List.of(BeapTestFixtures.attachment("art_0", "notes.txt", "text/plain"))));
        when(toolExecutor.execute(any())).thenReturn(ToolExecutionResult.succeeded("meeting notes", "", 4L));

        ReconstructionRecord record = service.reconstruct("m1");

        assertEquals(ReconstructionState.DONE, record.state());
        assertEquals(1, record.version());
        assertEquals(BeapTestFixtures.ENVELOPE_HASH, record.envelopeHash());
        assertEquals(ReconstructionState.DONE, records.getState("m1"));

        List<AuditEvent> events = ledger.getEvents("m1");
        assertEquals(List.of(AuditEventType.RECONSTRUCTED_STARTED, AuditEventType.RECONSTRUCTED_COMPLETED),
                events.stream().map(AuditEvent::type).toList());
        AuditEvent completed = events.get(1);
        assertEquals(List.of(hasher.sha256("meeting notes")), completed.refs().artefactHashes());
        assertEquals(hasher.hashOf(record), completed.refs().reconstructionHash());
        assertTrue(ledger.verifyChainIntegrity("m1"));
    }

    @Test
    void reconstruct_shouldBumpVersionOnEachAttempt() {
        messages.save(BeapTestFixtures.message("m1", VerificationStatus.ACCEPTED, List.of()));

        service.reconstruct("m1");
        ReconstructionRecord second = service.reconstruct("m1");

        assertEquals(2, second.version());
        assertEquals(4, ledger.getEvents("m1").size());
    }

    @Test
    void reconstruct_shouldSurviveRestartOfRecordStore() {
        messages.save(BeapTestFixtures.message("m1", VerificationStatus.ACCEPTED,
                List.of(BeapTestFixtures.attachment("art_0", "report.pdf", "application/pdf"))));
        when(toolExecutor.execute(any())).thenAnswer(invocation -> {
            ToolExecutionRequest request = invocation.getArgument(0);
            return request.operation() == ToolOperation.PARSE
                    ? ToolExecutionResult.succeeded("q3 numbers", "", 4L)
                    : ToolExecutionResult.succeeded("{\"pages\":[{\"pageNumber\":1,\"width\":10,\"height\":10,"
                            + "\"dataRef\":\"raster://1\"}]}", "", 4L);
        });

        service.reconstruct("m1");
        ReconstructionRecord restored = new ReconstructionRecordStore(documents).get("m1").orElseThrow();

        assertEquals(ReconstructionState.DONE, restored.state());
        assertEquals("q3 numbers", restored.semanticTextByArtefact().get(0).text());
        assertEquals(1, restored.rasterRefs().get(0).totalPages());
    }

    @Test
    void reconstruct_shouldRefuseRejectedMessagesBeforeAnyEvent() {
        messages.save(BeapTestFixtures.message("m2", VerificationStatus.REJECTED, List.of()));

        assertThrows(ReconstructionRefusedException.class, () -> service.reconstruct("m2"));
        assertTrue(ledger.getEvents("m2").isEmpty());
        assertEquals(ReconstructionState.NONE, records.getState("m2"));
        verifyNoInteractions(toolExecutor);
    }

    @Test
    void reconstruct_shouldRefuseArchivedMessagesBeforeAnyEvent() {
        messages.save(BeapTestFixtures.message("m3", VerificationStatus.ACCEPTED, List.of())
                .withFolder(BeapFolder.ARCHIVED));

        assertThrows(ReconstructionRefusedException.class, () -> service.reconstruct("m3"));
        assertTrue(ledger.getEvents("m3").isEmpty());
        assertEquals(ReconstructionState.NONE, records.getState("m3"));
        verifyNoInteractions(toolExecutor);
    }

    @Test
    void reconstruct_shouldFailForUnknownMessage() {
        assertThrows(MessageNotFoundException.class, () -> service.reconstruct("missing"));
        assertTrue(ledger.getEvents("missing").isEmpty());
    }

    @Test
    void recordStore_shouldServeCachedStateUntilReloaded() {
        messages.save(BeapTestFixtures.message("m1", VerificationStatus.ACCEPTED, List.of()));
        ReconstructionRecordStore observer = new ReconstructionRecordStore(documents);
        assertEquals(ReconstructionState.NONE, observer.getState("m1"));

        ReconstructionRecord record = service.reconstruct("m1");
        assertEquals(ReconstructionState.NONE, observer.getState("m1"));

        observer.load();
        assertEquals(record.state(), observer.getState("m1"));

        observer.reset();
        assertEquals(record, observer.get("m1").orElseThrow());
    }
}
