package com.chatflow.chatflow_backend.executor.call;

import com.chatflow.chatflow_backend.exception.ExternalCallException;
import com.chatflow.chatflow_backend.exception.GraphException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpExternalCallClientTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private HttpExternalCallClient client;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        client = new HttpExternalCallClient(httpClient, new ObjectMapper());
    }

    @Test
    void getSendsParamsAsQueryAndParsesJson() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"status\":\"shipped\"}");
        doReturn(response).when(httpClient).send(any(), any());

        ExternalCallResult result = client.invoke(
                Map.of("url", "https://orders.example.com/o/1", "headers", Map.of("X-Api-Key", "k")),
                Map.of("expand", "items lines"),
                Duration.ofSeconds(3));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("GET");
        assertThat(request.getValue().uri().toString()).isEqualTo("https://orders.example.com/o/1?expand=items+lines");
        assertThat(request.getValue().headers().firstValue("X-Api-Key")).contains("k");
        assertThat(request.getValue().timeout()).contains(Duration.ofSeconds(3));
        assertThat(result.path("status")).isEqualTo("shipped");
    }

    @Test
    void postSendsJsonBodyAndKeepsNonJsonAnswerAsText() throws Exception {
        when(response.statusCode()).thenReturn(201);
        when(response.body()).thenReturn("created");
        doReturn(response).when(httpClient).send(any(), any());

        ExternalCallResult result = client.invoke(Map.of("url", "https://orders.example.com", "method", "post"),
                Map.of("sku", "A1"), Duration.ofSeconds(3));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().headers().firstValue("Content-Type")).contains("application/json");
        assertThat(result.statusCode()).isEqualTo(201);
        assertThat(result.body()).isEqualTo("created");
    }

    @Test
    void serverErrorsAreRetryableClientErrorsAreNot() throws Exception {
        when(response.statusCode()).thenReturn(503, 404);
        doReturn(response).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.invoke(Map.of("url", "https://x.example.com"), Map.of(), Duration.ofSeconds(1)))
                .isInstanceOfSatisfying(ExternalCallException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getStatusCode()).isEqualTo(503);
                });
        assertThatThrownBy(() -> client.invoke(Map.of("url", "https://x.example.com"), Map.of(), Duration.ofSeconds(1)))
                .isInstanceOfSatisfying(ExternalCallException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void transportFailuresMapToRetryableErrors() throws Exception {
        doThrow(new HttpTimeoutException("slow")).when(httpClient).send(any(), any());
        assertThatThrownBy(() -> client.invoke(Map.of("url", "https://x.example.com"), Map.of(), Duration.ofMillis(250)))
                .isInstanceOfSatisfying(ExternalCallException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getMessage()).contains("timed out after 250 ms");
                });

        doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());
        assertThatThrownBy(() -> client.invoke(Map.of("url", "https://x.example.com"), Map.of(), Duration.ofSeconds(1)))
                .isInstanceOfSatisfying(ExternalCallException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    void missingOrInvalidUrlIsGraphError() {
        assertThatThrownBy(() -> client.invoke(Map.of(), Map.of(), Duration.ofSeconds(1)))
                .isInstanceOf(GraphException.class);
        assertThatThrownBy(() -> client.invoke(Map.of("url", "not a url"), Map.of(), Duration.ofSeconds(1)))
                .isInstanceOf(GraphException.class);
    }
}
