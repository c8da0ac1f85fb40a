package com.chatflow.chatflow_backend.executor.call;

import java.util.List;
import java.util.Map;

/**
 * Answer of an external call. {@code body} is the parsed JSON (map, list, scalar) or the raw text.
 */
public record ExternalCallResult(int statusCode, Object body) {

    /**
     * Reads a dotted path such as "data.items.0.name" out of the body.
     * Returns null when any segment is missing.
     */
    public Object path(String dottedPath) {
        if (dottedPath == null || dottedPath.isBlank() || "$".equals(dottedPath)) return body;

        String path = dottedPath.startsWith("$.") ? dottedPath.substring(2) : dottedPath;
        Object current = body;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                try {
                    int index = Integer.parseInt(segment);
                    current = index >= 0 && index < list.size() ? list.get(index) : null;
                } catch (NumberFormatException e) {
                    return null;
                }
            } else {
                return null;
            }
            if (current == null) return null;
        }
        return current;
    }
}
