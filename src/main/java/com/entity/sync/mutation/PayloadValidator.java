package com.entity.sync.mutation;

import com.entity.sync.core.model.SyncEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks payloads before they are applied locally.
 * A payload is well formed when it only contains strings, numbers, booleans, nulls,
 * collections and maps keyed by strings, nested at most {@value #MAX_DEPTH} levels.
 */
public class PayloadValidator {

    static final int MAX_DEPTH = 32;

    /**
     * Validates a full payload for a create.
     *
     * @throws ValidationException listing every violation found
     */
    public void validateCreate(Map<String, ?> payload) {
        List<String> violations = new ArrayList<>();
        if (payload == null) {
            throw new ValidationException(List.of("payload is required"));
        }
        Object name = payload.get(SyncEntity.NAME_FIELD);
        if (!(name instanceof String s) || s.isBlank()) {
            violations.add("name is required");
        }
        checkStructure(payload, "", 0, violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    /**
     * Validates a partial payload for an update. A name, when present, must not be blank.
     */
    public void validatePartial(Map<String, ?> partial) {
        List<String> violations = new ArrayList<>();
        if (partial == null || partial.isEmpty()) {
            throw new ValidationException(List.of("update must change at least one field"));
        }
        if (partial.containsKey(SyncEntity.NAME_FIELD)) {
            Object name = partial.get(SyncEntity.NAME_FIELD);
            if (!(name instanceof String s) || s.isBlank()) {
                violations.add("name must not be blank");
            }
        }
        checkStructure(partial, "", 0, violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private void checkStructure(Map<?, ?> map, String path, int depth, List<String> violations) {
        if (depth > MAX_DEPTH) {
            violations.add(describe(path) + " is nested too deeply");
            return;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                violations.add(describe(path) + " has a non-string key: " + entry.getKey());
                continue;
            }
            checkValue(entry.getValue(), path.isEmpty() ? key : path + "." + key, depth + 1, violations);
        }
    }

    private void checkValue(Object value, String path, int depth, List<String> violations) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return;
        }
        if (value instanceof Map<?, ?> nested) {
            checkStructure(nested, path, depth, violations);
        } else if (value instanceof Collection<?> collection) {
            if (depth > MAX_DEPTH) {
                violations.add(path + " is nested too deeply");
                return;
            }
            int i = 0;
            for (Object element : collection) {
                checkValue(element, path + "[" + i++ + "]", depth + 1, violations);
            }
        } else {
            violations.add(path + " has unsupported type " + value.getClass().getSimpleName());
        }
    }

    private static String describe(String path) {
        return path.isEmpty() ? "payload" : path;
    }
}
