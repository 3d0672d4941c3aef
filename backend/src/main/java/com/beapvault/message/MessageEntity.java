package com.beapvault.message;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("beap_messages")
public class MessageEntity {

    @PrimaryKey
    private String id;

    @Column("folder")
    private String folder;

    @Column("status")
    private String status;

    @Column("verification_status")
    private String verificationStatus;

    @Column("delivery_status")
    private String deliveryStatus;

    @Column("direction")
    private String direction;

    @Column("delivery_method")
    private String deliveryMethod;

    @Column("title")
    private String title;

    @Column("message_time")
    private long timestamp;

    @Column("fingerprint")
    private String fingerprint;

    @Column("fingerprint_full")
    private String fingerprintFull;

    @Column("sender_name")
    private String senderName;

    @Column("channel_site")
    private String channelSite;

    /** Opaque reference to the still-encrypted capsule. */
    @Column("capsule_ref")
    private String capsuleRef;

    /*
     * Structured parts are stored as JSON text. They are only ever read back
     * whole, so there is nothing to gain from mapping them to UDTs.
     */
    @Column("attachments_json")
    private String attachmentsJson;

    @Column("envelope_json")
    private String envelopeJson;

    @Column("envelope_summary_json")
    private String envelopeSummaryJson;

    @Column("capsule_metadata_json")
    private String capsuleMetadataJson;

    @Column("rejection_reason_json")
    private String rejectionReasonJson;

    @Column("delivery_attempts")
    private int deliveryAttempts;

    public MessageEntity() {}

    // Getters & Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getFolder() { return folder; }
    public void setFolder(String folder) { this.folder = folder; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getVerificationStatus() { return verificationStatus; }
    public void setVerificationStatus(String verificationStatus) { this.verificationStatus = verificationStatus; }
    public String getDeliveryStatus() { return deliveryStatus; }
    public void setDeliveryStatus(String deliveryStatus) { this.deliveryStatus = deliveryStatus; }
    public String getDirection() { return direction; }
    public void setDirection(String direction) { this.direction = direction; }
    public String getDeliveryMethod() { return deliveryMethod; }
    public void setDeliveryMethod(String deliveryMethod) { this.deliveryMethod = deliveryMethod; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public long getTimestamp() { return timestamp; }
    public void setTimestamp(long timestamp) { this.timestamp = timestamp; }
    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public String getFingerprintFull() { return fingerprintFull; }
    public void setFingerprintFull(String fingerprintFull) { this.fingerprintFull = fingerprintFull; }
    public String getSenderName() { return senderName; }
    public void setSenderName(String senderName) { this.senderName = senderName; }
    public String getChannelSite() { return channelSite; }
    public void setChannelSite(String channelSite) { this.channelSite = channelSite; }
    public String getCapsuleRef() { return capsuleRef; }
    public void setCapsuleRef(String capsuleRef) { this.capsuleRef = capsuleRef; }
    public String getAttachmentsJson() { return attachmentsJson; }
    public void setAttachmentsJson(String attachmentsJson) { this.attachmentsJson = attachmentsJson; }
    public String getEnvelopeJson() { return envelopeJson; }
    public void setEnvelopeJson(String envelopeJson) { this.envelopeJson = envelopeJson; }
    public String getEnvelopeSummaryJson() { return envelopeSummaryJson; }
    public void setEnvelopeSummaryJson(String envelopeSummaryJson) { this.envelopeSummaryJson = envelopeSummaryJson; }
    public String getCapsuleMetadataJson() { return capsuleMetadataJson; }
    public void setCapsuleMetadataJson(String capsuleMetadataJson) { this.capsuleMetadataJson = capsuleMetadataJson; }
    public String getRejectionReasonJson() { return rejectionReasonJson; }
    public void setRejectionReasonJson(String rejectionReasonJson) { this.rejectionReasonJson = rejectionReasonJson; }
    public int getDeliveryAttempts() { return deliveryAttempts; }
    public void setDeliveryAttempts(int deliveryAttempts) { this.deliveryAttempts = deliveryAttempts; }
}
