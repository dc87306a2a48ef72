package com.entity.sync.bulk;

import com.entity.sync.api.EntitySyncService;
import com.entity.sync.core.model.SyncEntity;
import com.entity.sync.mutation.MissingIdentityException;
import com.entity.sync.mutation.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads JSON export documents and creates each entity optimistically through the service.
 * Imported entities get fresh temporary ids, version 1 and the importing user as owner;
 * ids, owners and versions found in the document are ignored.
 *
 * <p>Accepts {@code entity}/{@code entities} as well as {@code character}/{@code characters}.</p>
 */
public class EntityJsonImporter {
    private static final Logger log = LoggerFactory.getLogger(EntityJsonImporter.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final EntitySyncService service;
    private final ObjectMapper objectMapper;

    public EntityJsonImporter(EntitySyncService service) {
        this(service, new ObjectMapper());
    }

    public EntityJsonImporter(EntitySyncService service, ObjectMapper objectMapper) {
        this.service = service;
        this.objectMapper = objectMapper;
    }

    public ImportResult importEntities(String json, ProgressCallback callback) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return invalid("Invalid JSON: " + e.getOriginalMessage());
        }
        return importDocument(root, callback);
    }

    public ImportResult importEntities(Reader reader, ProgressCallback callback) {
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (IOException e) {
            return invalid("Invalid JSON: " + e.getMessage());
        }
        return importDocument(root, callback);
    }

    private ImportResult importDocument(JsonNode root, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        if (root == null || !root.isObject()) {
            return invalid("Import document must be a JSON object");
        }
        List<String> warnings = new ArrayList<>();
        JsonNode version = root.get("version");
        if (version == null || version.isNull()) {
            warnings.add("No version specified in import file");
        } else if (!EntityJsonExporter.FORMAT_VERSION.equals(version.asText())) {
            warnings.add("Import file version (" + version.asText() + ") differs from current version ("
                    + EntityJsonExporter.FORMAT_VERSION + ")");
        }

        List<JsonNode> records = records(root);
        if (records.isEmpty()) {
            return new ImportResult(0, List.of(),
                    List.of(new ImportResult.ImportError(-1, null, "No entity data found in import file")), warnings);
        }

        List<String> created = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            JsonNode record = records.get(i);
            String name = record.path("name").isTextual() ? record.get("name").asText() : null;
            List<String> problems = check(record, i, warnings);
            if (!problems.isEmpty()) {
                errors.add(new ImportResult.ImportError(i, name, String.join("; ", problems)));
            } else {
                try {
                    SyncEntity entity = service.create(toPayload(record, name));
                    created.add(entity.getId());
                } catch (ValidationException | MissingIdentityException e) {
                    errors.add(new ImportResult.ImportError(i, name, e.getMessage()));
                    log.warn("import.error index={} name='{}' error={}", i, name, e.getMessage());
                }
            }
            cb.onProgress(i + 1, records.size(), "Imported " + (i + 1) + " of " + records.size());
        }

        ImportResult result = new ImportResult(records.size(), created, errors, warnings);
        log.info("import.completed result={}", result);
        return result;
    }

    private static List<JsonNode> records(JsonNode root) {
        List<JsonNode> records = new ArrayList<>();
        for (String key : List.of("entities", "characters")) {
            JsonNode array = root.get(key);
            if (array != null && array.isArray()) {
                array.forEach(records::add);
                return records;
            }
        }
        for (String key : List.of("entity", "character")) {
            JsonNode single = root.get(key);
            if (single != null && single.isObject()) {
                records.add(single);
                return records;
            }
        }
        return records;
    }

    private static List<String> check(JsonNode record, int index, List<String> warnings) {
        List<String> problems = new ArrayList<>();
        if (!record.isObject()) {
            problems.add("Entity record must be an object");
            return problems;
        }
        JsonNode name = record.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            problems.add("Entity name is required and must be a string");
        }
        JsonNode data = record.get("data");
        if (data == null || !data.isObject()) {
            problems.add("Entity data is required and must be an object");
        }
        JsonNode version = record.get("version");
        if (version != null && !version.isNumber()) {
            warnings.add("Record " + index + ": version should be a number, will be reset on import");
        }
        JsonNode controlledBy = record.get("controlledBy");
        if (controlledBy != null && !controlledBy.isArray()) {
            warnings.add("Record " + index + ": controlledBy should be an array, will be reset on import");
        }
        return problems;
    }

    private Map<String, Object> toPayload(JsonNode record, String name) {
        Map<String, Object> payload = new LinkedHashMap<>(objectMapper.convertValue(record.get("data"), MAP_TYPE));
        payload.put(SyncEntity.NAME_FIELD, name);
        return payload;
    }

    private static ImportResult invalid(String message) {
        log.warn("import.failed error={}", message);
        return new ImportResult(0, List.of(), List.of(new ImportResult.ImportError(-1, null, message)), List.of());
    }
}
