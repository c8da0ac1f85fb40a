package com.chatflow.chatflow_backend.executor.call;

import com.chatflow.chatflow_backend.exception.GraphException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class ExternalCallClientRegistry {

    private final Map<String, ExternalCallClient> clients = new HashMap<>();

    public ExternalCallClientRegistry(List<ExternalCallClient> all) {
        for (ExternalCallClient client : all) {
            String key = client.capability().toLowerCase();
            if (clients.putIfAbsent(key, client) != null) {
                throw new IllegalStateException("Duplicate external call client for capability: " + key);
            }
        }
    }

    public ExternalCallClient get(String capability) {
        ExternalCallClient client = clients.get(capability.toLowerCase());
        if (client == null) {
            throw new GraphException("No external call client for capability: " + capability);
        }
        return client;
    }
}
