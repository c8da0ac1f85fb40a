package com.chatflow.chatflow_backend.executor.call;

import com.chatflow.chatflow_backend.exception.ExternalCallException;
import com.chatflow.chatflow_backend.exception.GraphException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Plain HTTP/JSON calls.
 *
 * Config shape:
 * {
 *   "url":     "https://api.example.com/orders/{{order_id}}",
 *   "method":  "GET",
 *   "headers": { "Authorization": "Bearer {{token}}" },
 *   "params":  { "status": "open" }
 * }
 */
@Slf4j
@Component
public class HttpExternalCallClient implements ExternalCallClient {

    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public HttpExternalCallClient(HttpClient httpClient, ObjectMapper mapper) {
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    @Override
    public String capability() {
        return "http";
    }

    @Override
    public ExternalCallResult invoke(Map<String, Object> config, Map<String, Object> params, Duration timeout) {
        Object rawUrl = config.get("url");
        if (rawUrl == null || rawUrl.toString().isBlank()) {
            throw new GraphException("External call has no url configured");
        }
        String method = config.getOrDefault("method", "GET").toString().toUpperCase();
        String url = rawUrl.toString();

        HttpRequest request = buildRequest(url, method, config.get("headers"), params, timeout);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("[HTTP] {} {} -> {}", method, url, status);
                throw ExternalCallException.forStatus(method + " " + url, status);
            }
            log.debug("[HTTP] {} {} -> {}", method, url, status);
            return new ExternalCallResult(status, parseBody(response.body()));
        } catch (HttpTimeoutException e) {
            throw ExternalCallException.timeout(method + " " + url, timeout.toMillis());
        } catch (IOException e) {
            throw new ExternalCallException("External call to " + method + " " + url + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException("External call to " + method + " " + url + " was interrupted", false, e);
        }
    }

    private HttpRequest buildRequest(String url, String method, Object headers,
                                     Map<String, Object> params, Duration timeout) {
        HttpRequest.Builder builder;
        try {
            if ("GET".equals(method) || "DELETE".equals(method)) {
                builder = HttpRequest.newBuilder().uri(URI.create(withQuery(url, params)));
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            } else {
                String json = mapper.writeValueAsString(params != null ? params : Map.of());
                builder = HttpRequest.newBuilder().uri(URI.create(url))
                        .header("Content-Type", "application/json")
                        .method(method, HttpRequest.BodyPublishers.ofString(json));
            }
        } catch (IllegalArgumentException e) {
            throw new GraphException("External call has an invalid url: " + url);
        } catch (JsonProcessingException e) {
            throw new GraphException("External call params are not serializable: " + e.getOriginalMessage());
        }

        builder.timeout(timeout);
        if (headers instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                if (k != null && v != null) builder.header(k.toString(), v.toString());
            });
        }
        return builder.build();
    }

    private static String withQuery(String url, Map<String, Object> params) {
        if (params == null || params.isEmpty()) return url;
        String query = params.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue().toString()))
                .collect(Collectors.joining("&"));
        if (query.isEmpty()) return url;
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private Object parseBody(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return mapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            return body;
        }
    }
}
