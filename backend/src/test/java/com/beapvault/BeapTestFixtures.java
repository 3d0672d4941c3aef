package com.beapvault;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import com.beapvault.crypto.ContentHasher;
import com.beapvault.evaluation.BeapEnvelope;
import com.beapvault.evaluation.CapsuleMetadata;
import com.beapvault.evaluation.EgressDeclaration;
import com.beapvault.evaluation.EgressType;
import com.beapvault.evaluation.EnvelopeSummary;
import com.beapvault.evaluation.EvaluationStep;
import com.beapvault.evaluation.ImportSource;
import com.beapvault.evaluation.IncomingMessage;
import com.beapvault.evaluation.IngressChannel;
import com.beapvault.evaluation.IngressDeclaration;
import com.beapvault.evaluation.IngressType;
import com.beapvault.evaluation.RejectionCode;
import com.beapvault.evaluation.RejectionReason;
import com.beapvault.evaluation.SignatureStatus;
import com.beapvault.evaluation.VerificationStatus;
import com.beapvault.message.BeapFolder;
import com.beapvault.message.BeapMessage;
import com.beapvault.message.MessageAttachment;
import com.beapvault.storage.InMemoryKeyValueStore;
import com.beapvault.storage.JsonDocumentStore;
import com.beapvault.storage.KeyValueStore;
import com.beapvault.tools.BundledTools;
import com.beapvault.tools.ToolExecutionLog;
import com.beapvault.tools.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared builders for envelopes, incoming messages and in-memory storage.
 */
public final class BeapTestFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    public static final String ENVELOPE_HASH = "9f2c4a7be1d03f5a6c8e7b9d0a1f2e3c4b5a69788796a5b4c3d2e1f0a9b8c7d6";

    public static final String TIKA_HASH = "3b8f0c1e9a7d4f6b2c5e8a1d0f9b7c6e4a3d2b1c0e9f8a7b6c5d4e3f2a1b0c9d";
    public static final String PDFIUM_HASH = "a1b2c3d4e5f60718293a4b5c6d7e8f90a1b2c3d4e5f60718293a4b5c6d7e8f90";

    private BeapTestFixtures() {}

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static JsonDocumentStore documents(KeyValueStore store) {
        return new JsonDocumentStore(store, new ObjectMapper());
    }

    public static JsonDocumentStore inMemoryDocuments() {
        return documents(new InMemoryKeyValueStore());
    }

    public static ContentHasher hasher() {
        return new ContentHasher();
    }

    /** A tool registry with both bundled tools installed and verified. */
    public static ToolRegistry readyToolRegistry() {
        ToolRegistry registry = new ToolRegistry(inMemoryDocuments(), new ToolExecutionLog(), fixedClock());
        registry.registerTool(BundledTools.APACHE_TIKA, "2.9.1", TIKA_HASH, "/opt/beap/tika/tika-app.jar");
        registry.registerTool(BundledTools.PDFIUM, "6312", PDFIUM_HASH, "/opt/beap/pdfium/pdfium-render");
        registry.verifyAllTools();
        return registry;
    }

    public static EnvelopeBuilder envelope() {
        return new EnvelopeBuilder();
    }

    /** Like {@link #envelope()}, but valid against the wall clock for tests running the full application. */
    public static EnvelopeBuilder liveEnvelope() {
        return new EnvelopeBuilder().expiresAt(Instant.now().plus(Duration.ofDays(1)).toEpochMilli());
    }

    public static IncomingMessage incoming(String id, BeapEnvelope envelope) {
        return incoming(id, envelope, List.of());
    }

    public static IncomingMessage incoming(String id, BeapEnvelope envelope, List<String> attachmentNames) {
        List<String> refs = new ArrayList<>();
        for (int i = 0; i < attachmentNames.size(); i++) {
            refs.add("enc-artefact-" + i);
        }
        CapsuleMetadata capsule = new CapsuleMetadata("cap-" + id, "Quarterly report", attachmentNames.size(),
                attachmentNames, 0, false, 2048L);
        return new IncomingMessage(id, envelope, capsule, "enc-capsule-" + id, refs, ImportSource.FILE,
                NOW.toEpochMilli());
    }

    /** A stored inbound message already in {@code status}, with the default envelope. */
    public static BeapMessage message(String id, VerificationStatus status, List<MessageAttachment> attachments) {
        BeapEnvelope envelope = envelope().build();
        boolean rejected = status == VerificationStatus.REJECTED;
        RejectionReason reason = rejected
                ? new RejectionReason(RejectionCode.EGRESS_MISSING,
                        "Egress declarations are missing. Cannot determine execution boundaries.",
                        "The envelope does not declare any egress destinations.",
                        NOW.toEpochMilli(), EvaluationStep.BOUNDARY_CHECK)
                : null;
        return new BeapMessage(id, rejected ? BeapFolder.REJECTED : BeapFolder.INBOX,
                status.name().toLowerCase(java.util.Locale.ROOT), status, null, BeapMessage.INBOUND, "file",
                "Quarterly report", NOW.toEpochMilli(), "A1B2C3D4E5F6", envelope.senderFingerprint(), null, null,
                "enc-capsule-" + id, attachments, envelope, EnvelopeSummary.of(envelope, NOW.toEpochMilli()), null,
                reason, 0);
    }

    public static MessageAttachment attachment(String artefactId, String name, String mimeType) {
        return new MessageAttachment(artefactId, name, mimeType, 4096L, "enc://" + artefactId, "orig-" + artefactId);
    }

    /**
     * Defaults describe an envelope every default policy accepts: signed, hashed,
     * unexpired, verified handshake ingress, email egress, download channel.
     */
    public static final class EnvelopeBuilder {
        private String envelopeId = "env-0001-abcdef";
        private String envelopeHash = ENVELOPE_HASH;
        private SignatureStatus signatureStatus = SignatureStatus.VALID;
        private String senderFingerprint = "A1B2C3D4E5F60718293A4B5C6D7E8F90";
        private IngressChannel channel = IngressChannel.DOWNLOAD;
        private String emailProviderId;
        private List<IngressDeclaration> ingress =
                List.of(new IngressDeclaration(IngressType.HANDSHAKE, "hs-alice", true));
        private List<EgressDeclaration> egress =
                List.of(new EgressDeclaration(EgressType.EMAIL, "alice@example.com", false));
        private long createdAt = NOW.minus(Duration.ofHours(1)).toEpochMilli();
        private Long expiresAt = NOW.plus(Duration.ofDays(1)).toEpochMilli();

        public EnvelopeBuilder envelopeHash(String envelopeHash) { this.envelopeHash = envelopeHash; return this; }
        public EnvelopeBuilder signatureStatus(SignatureStatus status) { this.signatureStatus = status; return this; }
        public EnvelopeBuilder channel(IngressChannel channel) { this.channel = channel; return this; }
        public EnvelopeBuilder emailProviderId(String id) { this.emailProviderId = id; return this; }
        public EnvelopeBuilder ingress(List<IngressDeclaration> ingress) { this.ingress = ingress; return this; }
        public EnvelopeBuilder egress(List<EgressDeclaration> egress) { this.egress = egress; return this; }
        public EnvelopeBuilder expiresAt(Long expiresAt) { this.expiresAt = expiresAt; return this; }

        public BeapEnvelope build() {
            return new BeapEnvelope(envelopeId, "pkg-0001", envelopeHash, signatureStatus, senderFingerprint,
                    "F0E1D2C3B4A5968778695A4B3C2D1E0F", "hs-alice", channel, emailProviderId, ingress, egress,
                    createdAt, expiresAt);
        }
    }
}
