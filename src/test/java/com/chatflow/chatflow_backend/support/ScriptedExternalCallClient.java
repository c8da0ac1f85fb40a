package com.chatflow.chatflow_backend.support;

import com.chatflow.chatflow_backend.executor.call.ExternalCallClient;
import com.chatflow.chatflow_backend.executor.call.ExternalCallResult;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Answers each invocation with the next scripted step; the last step repeats. */
public class ScriptedExternalCallClient implements ExternalCallClient {

    private final Deque<Supplier<ExternalCallResult>> steps = new ArrayDeque<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private volatile Map<String, Object> lastConfig;
    private volatile Map<String, Object> lastParams;

    public ScriptedExternalCallClient then(Supplier<ExternalCallResult> step) {
        steps.add(step);
        return this;
    }

    @Override
    public String capability() {
        return "http";
    }

    @Override
    public ExternalCallResult invoke(Map<String, Object> config, Map<String, Object> params, Duration timeout) {
        invocations.incrementAndGet();
        lastConfig = config;
        lastParams = params;
        Supplier<ExternalCallResult> step = steps.size() > 1 ? steps.poll() : steps.peek();
        if (step == null) {
            throw new IllegalStateException("no scripted answer");
        }
        return step.get();
    }

    public int invocations() {
        return invocations.get();
    }

    public Map<String, Object> lastConfig() {
        return lastConfig;
    }

    public Map<String, Object> lastParams() {
        return lastParams;
    }
}
