package com.chatflow.chatflow_backend.executor.call;

import java.time.Duration;
import java.util.Map;

/**
 * Performs the side effect of an EXTERNAL_CALL node. Implementations are looked up by
 * {@link #capability()}, which matches the node's "capability" config (default "http").
 */
public interface ExternalCallClient {

    String capability();

    /**
     * @param config  the node config with every string leaf already resolved against the variables
     * @param params  resolved request parameters (query string for GET, JSON body otherwise)
     * @param timeout hard limit for the whole call
     * @throws com.chatflow.chatflow_backend.exception.ExternalCallException on timeout, transport
     *         failure or an unsuccessful answer
     */
    ExternalCallResult invoke(Map<String, Object> config, Map<String, Object> params, Duration timeout);
}
