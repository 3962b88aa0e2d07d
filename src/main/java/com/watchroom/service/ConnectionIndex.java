package com.watchroom.service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.watchroom.model.ConnectionBinding;

/**
 * Maps each live connection to the room identity it currently represents.
 * Events are attributed through this index only, never through payload fields.
 */
@Component
public class ConnectionIndex {

    // Connection ID -> binding
    private final Map<String, ConnectionBinding> bindings = new ConcurrentHashMap<>();

    public void bind(String connectionId, ConnectionBinding binding) {
        bindings.put(connectionId, binding);
    }

    public Optional<ConnectionBinding> lookup(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(connectionId));
    }

    public Optional<ConnectionBinding> unbind(String connectionId) {
        return Optional.ofNullable(bindings.remove(connectionId));
    }

    public int size() {
        return bindings.size();
    }
}
