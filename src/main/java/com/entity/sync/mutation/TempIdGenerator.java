package com.entity.sync.mutation;

import java.util.UUID;

/**
 * Generates and recognizes temporary ids for entities not yet confirmed by the server.
 */
public class TempIdGenerator {

    private final String prefix;

    public TempIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    public String next() {
        return prefix + UUID.randomUUID();
    }

    public boolean isTemporary(String id) {
        return id != null && id.startsWith(prefix);
    }
}
