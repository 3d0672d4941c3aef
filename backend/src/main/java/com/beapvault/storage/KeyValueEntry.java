package com.beapvault.storage;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("kv_store")
public class KeyValueEntry {

    @PrimaryKey
    private String key;

    /** Serialized JSON document. Opaque to Cassandra. */
    @Column("value")
    private String value;

    @Column("updated_at")
    private long updatedAt;

    public KeyValueEntry() {}

    public KeyValueEntry(String key, String value, long updatedAt) {
        this.key = key;
        this.value = value;
        this.updatedAt = updatedAt;
    }

    // Getters & Setters
    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }
    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }
    public long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }
}
