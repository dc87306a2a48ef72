package com.entity.sync.bulk;

import com.entity.sync.core.model.SyncEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes entities as JSON export documents.
 *
 * <pre>
 * {
 *   "version": "1.0",
 *   "exportDate": "2025-11-05T10:00:00Z",
 *   "entities": [ { "id": ..., "name": ..., "data": {...}, ... } ],
 *   "count": 1,
 *   "metadata": { ... }
 * }
 * </pre>
 *
 * A single-entity document carries {@code entity} instead of {@code entities} and {@code count}.
 * The runtime sync status is never exported.
 */
public class EntityJsonExporter {
    private static final Logger log = LoggerFactory.getLogger(EntityJsonExporter.class);

    public static final String FORMAT_VERSION = "1.0";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EntityJsonExporter() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public EntityJsonExporter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public String exportEntity(SyncEntity entity, Map<String, ?> metadata) {
        Map<String, Object> document = header();
        document.put("entity", toRecord(entity));
        document.put("metadata", metadata != null ? metadata : Map.of());
        return write(document);
    }

    public String exportEntities(Collection<SyncEntity> entities, Map<String, ?> metadata) {
        return write(collectionDocument(entities, metadata));
    }

    public ExportResult exportEntities(Collection<SyncEntity> entities, Map<String, ?> metadata, Writer writer) {
        try {
            objectMapper.writeValue(writer, collectionDocument(entities, metadata));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write export", e);
        }
        ExportResult result = new ExportResult(entities.size(), FORMAT_VERSION);
        log.info("export.completed result={}", result);
        return result;
    }

    private Map<String, Object> collectionDocument(Collection<SyncEntity> entities, Map<String, ?> metadata) {
        Map<String, Object> document = header();
        List<Map<String, Object>> records = new ArrayList<>(entities.size());
        for (SyncEntity entity : entities) {
            records.add(toRecord(entity));
        }
        document.put("count", records.size());
        document.put("entities", records);
        document.put("metadata", metadata != null ? metadata : Map.of());
        return document;
    }

    private Map<String, Object> header() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("version", FORMAT_VERSION);
        document.put("exportDate", clock.instant().toString());
        return document;
    }

    private Map<String, Object> toRecord(SyncEntity entity) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", entity.getId());
        record.put("name", entity.getName());
        if (entity.getOwnerId() != null) {
            record.put("ownerId", entity.getOwnerId());
        }
        record.put("controlledBy", new ArrayList<>(entity.getControlledBy()));
        Map<String, Object> data = new LinkedHashMap<>(entity.getPayload());
        data.remove(SyncEntity.NAME_FIELD);
        record.put("data", data);
        record.put("version", entity.getVersion());
        record.put("createdAt", entity.getCreatedAt().toString());
        record.put("updatedAt", entity.getUpdatedAt().toString());
        return record;
    }

    private String write(Map<String, Object> document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize export", e);
        }
    }
}
