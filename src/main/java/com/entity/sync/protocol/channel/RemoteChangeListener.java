package com.entity.sync.protocol.channel;

import com.entity.sync.core.model.RemoteChange;

/**
 * Receives changes broadcast by the server on behalf of other clients.
 */
@FunctionalInterface
public interface RemoteChangeListener {

    void onRemoteChange(RemoteChange change);
}
