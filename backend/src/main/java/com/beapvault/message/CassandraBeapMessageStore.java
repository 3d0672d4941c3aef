package com.beapvault.message;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.beapvault.evaluation.BeapEnvelope;
import com.beapvault.evaluation.CapsuleMetadata;
import com.beapvault.evaluation.EnvelopeSummary;
import com.beapvault.evaluation.RejectionReason;
import com.beapvault.evaluation.VerificationStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link BeapMessageStore} over the {@code beap_messages} table. Repository calls are
 * blocked on with the configured storage timeout.
 */
public class CassandraBeapMessageStore implements BeapMessageStore {

    private static final TypeReference<List<MessageAttachment>> ATTACHMENTS = new TypeReference<>() {};

    private final MessageRepository repository;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public CassandraBeapMessageStore(MessageRepository repository, ObjectMapper objectMapper, Duration timeout) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public Optional<BeapMessage> getMessageById(String messageId) {
        return repository.findById(messageId)
                .map(this::toMessage)
                .blockOptional(timeout);
    }

    @Override
    public void save(BeapMessage message) {
        repository.save(toEntity(message)).block(timeout);
    }

    @Override
    public void moveToFolder(String messageId, BeapFolder folder) {
        BeapMessage message = getMessageById(messageId).orElseThrow(() -> new MessageNotFoundException(messageId));
        save(message.withFolder(folder));
    }

    @Override
    public void updateMessageStatus(String messageId, String status) {
        BeapMessage message = getMessageById(messageId).orElseThrow(() -> new MessageNotFoundException(messageId));
        save(message.withStatus(status));
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private MessageEntity toEntity(BeapMessage message) {
        MessageEntity entity = new MessageEntity();
        entity.setId(message.id());
        entity.setFolder(message.folder().name().toLowerCase(Locale.ROOT));
        entity.setStatus(message.status());
        entity.setVerificationStatus(message.verificationStatus() == null
                ? null : message.verificationStatus().name().toLowerCase(Locale.ROOT));
        entity.setDeliveryStatus(message.deliveryStatus());
        entity.setDirection(message.direction());
        entity.setDeliveryMethod(message.deliveryMethod());
        entity.setTitle(message.title());
        entity.setTimestamp(message.timestamp());
        entity.setFingerprint(message.fingerprint());
        entity.setFingerprintFull(message.fingerprintFull());
        entity.setSenderName(message.senderName());
        entity.setChannelSite(message.channelSite());
        entity.setCapsuleRef(message.capsuleRef());
        entity.setAttachmentsJson(write(message.attachments()));
        entity.setEnvelopeJson(write(message.envelope()));
        entity.setEnvelopeSummaryJson(write(message.envelopeSummary()));
        entity.setCapsuleMetadataJson(write(message.capsuleMetadata()));
        entity.setRejectionReasonJson(write(message.rejectionReason()));
        entity.setDeliveryAttempts(message.deliveryAttempts());
        return entity;
    }

    private BeapMessage toMessage(MessageEntity entity) {
        return new BeapMessage(
                entity.getId(),
                BeapFolder.valueOf(entity.getFolder().toUpperCase(Locale.ROOT)),
                entity.getStatus(),
                entity.getVerificationStatus() == null
                        ? null : VerificationStatus.valueOf(entity.getVerificationStatus().toUpperCase(Locale.ROOT)),
                entity.getDeliveryStatus(),
                entity.getDirection(),
                entity.getDeliveryMethod(),
                entity.getTitle(),
                entity.getTimestamp(),
                entity.getFingerprint(),
                entity.getFingerprintFull(),
                entity.getSenderName(),
                entity.getChannelSite(),
                entity.getCapsuleRef(),
                read(entity.getAttachmentsJson(), ATTACHMENTS),
                read(entity.getEnvelopeJson(), BeapEnvelope.class),
                read(entity.getEnvelopeSummaryJson(), EnvelopeSummary.class),
                read(entity.getCapsuleMetadataJson(), CapsuleMetadata.class),
                read(entity.getRejectionReasonJson(), RejectionReason.class),
                entity.getDeliveryAttempts());
    }

    private String write(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize message field", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " column", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt message column", e);
        }
    }
}
