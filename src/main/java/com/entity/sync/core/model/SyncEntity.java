package com.entity.sync.core.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A server-owned entity (typically a character sheet) as cached by the client.
 * Instances are immutable; every change produces a new instance through the {@code with*}
 * methods or {@link #toBuilder()}.
 */
public final class SyncEntity {
    public static final String NAME_FIELD = "name";

    private final String id;
    private final long version;
    private final Map<String, Object> payload;
    private final SyncStatus syncStatus;
    private final String ownerId;
    private final Set<String> controlledBy;
    private final Instant createdAt;
    private final Instant updatedAt;

    private SyncEntity(Builder builder) {
        this.id = builder.id;
        this.version = builder.version;
        this.payload = Payloads.deepCopy(builder.payload);
        this.syncStatus = builder.syncStatus != null ? builder.syncStatus : SyncStatus.LOCAL;
        this.ownerId = builder.ownerId;
        this.controlledBy = builder.controlledBy != null ? Set.copyOf(builder.controlledBy) : Set.of();
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public SyncStatus getSyncStatus() {
        return syncStatus;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Set<String> getControlledBy() {
        return controlledBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Display name taken from the payload's {@code name} field, or null.
     */
    public String getName() {
        Object name = payload.get(NAME_FIELD);
        return name instanceof String s ? s : null;
    }

    public boolean isSynced() {
        return syncStatus == SyncStatus.SYNCED;
    }

    /**
     * Whether the given user may mutate this entity. Unowned entities are editable by anyone.
     */
    public boolean canEdit(String userId) {
        if (ownerId == null) {
            return true;
        }
        return ownerId.equals(userId) || controlledBy.contains(userId);
    }

    public SyncEntity withStatus(SyncStatus status) {
        return toBuilder().syncStatus(status).build();
    }

    public SyncEntity withVersion(long version) {
        return toBuilder().version(version).updatedAt(Instant.now()).build();
    }

    public SyncEntity withId(String id) {
        return toBuilder().id(id).build();
    }

    /**
     * Shallow-merges a partial payload into this entity's payload.
     */
    public SyncEntity merge(Map<String, ?> partial) {
        return toBuilder()
                .payload(Payloads.shallowMerge(payload, partial))
                .updatedAt(Instant.now())
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncEntity that = (SyncEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SyncEntity{" +
                "id='" + id + '\'' +
                ", name='" + getName() + '\'' +
                ", version=" + version +
                ", syncStatus=" + syncStatus +
                ", ownerId='" + ownerId + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .version(version)
                .payload(payload)
                .syncStatus(syncStatus)
                .ownerId(ownerId)
                .controlledBy(controlledBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private long version = 1;
        private Map<String, ?> payload;
        private SyncStatus syncStatus;
        private String ownerId;
        private Set<String> controlledBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder payload(Map<String, ?> payload) {
            this.payload = payload;
            return this;
        }

        public Builder syncStatus(SyncStatus syncStatus) {
            this.syncStatus = syncStatus;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder controlledBy(Set<String> controlledBy) {
            this.controlledBy = controlledBy != null ? new LinkedHashSet<>(controlledBy) : null;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public SyncEntity build() {
            Objects.requireNonNull(id, "id is required");
            if (version < 1) {
                throw new IllegalArgumentException("version must be >= 1");
            }
            return new SyncEntity(this);
        }
    }
}
