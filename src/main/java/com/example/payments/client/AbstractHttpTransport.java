package com.example.payments.client;

import com.example.payments.error.ApiError;
import com.example.payments.error.PaymentApiException;
import com.example.payments.error.SerializationException;
import com.example.payments.error.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Request building and response decoding shared by the blocking and the
 * asynchronous transport. Subclasses only decide how a request is sent.
 */
public abstract class AbstractHttpTransport implements ApiTransport {

    private static final Logger logger = LoggerFactory.getLogger(AbstractHttpTransport.class);

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final ClientConfig config;
    private final FormEncoder formEncoder;

    protected AbstractHttpTransport(ClientConfig config) {
        this(
                HttpClient.newBuilder()
                        .connectTimeout(config.connectTimeout())
                        .build(),
                ApiObjectMapper.create(),
                config
        );
    }

    protected AbstractHttpTransport(HttpClient httpClient, ObjectMapper objectMapper, ClientConfig config) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = config;
        this.formEncoder = new FormEncoder(objectMapper);
    }

    /**
     * Sends {@code request} and decodes a successful body as {@code responseType}.
     */
    protected abstract <T> CompletableFuture<T> execute(HttpRequest request, JavaType responseType);

    @Override
    public <T> CompletableFuture<T> get(String path, JavaType responseType) {
        return send("GET", path, null, responseType);
    }

    @Override
    public <T> CompletableFuture<T> postForm(String path, Object form, JavaType responseType) {
        String body;
        try {
            body = formEncoder.encode(form);
        } catch (PaymentApiException e) {
            return CompletableFuture.failedFuture(e);
        }
        return send("POST", path, body, responseType);
    }

    @Override
    public <T> CompletableFuture<T> post(String path, JavaType responseType) {
        return send("POST", path, "", responseType);
    }

    @Override
    public <T> CompletableFuture<T> delete(String path, JavaType responseType) {
        return send("DELETE", path, null, responseType);
    }

    @Override
    public String encode(Object params) {
        return formEncoder.encode(params);
    }

    @Override
    public String versionPrefix() {
        return config.versionPrefix();
    }

    public ClientConfig getConfig() {
        return config;
    }

    private <T> CompletableFuture<T> send(String method, String path, String formBody, JavaType responseType) {
        HttpRequest request;
        try {
            request = buildRequest(method, path, formBody);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new TransportException("Invalid request path: " + path, e));
        }
        logger.debug("{} {}", method, request.uri());
        return execute(request, responseType);
    }

    HttpRequest buildRequest(String method, String path, String formBody) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + relative))
                .header("Accept", "application/json")
                .header("User-Agent", config.userAgent())
                .timeout(config.requestTimeout());

        for (Map.Entry<String, String> header : config.headers().asMap().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        if (formBody != null) {
            builder.header("Content-Type", "application/x-www-form-urlencoded")
                    .method(method, HttpRequest.BodyPublishers.ofString(formBody));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    /**
     * Turns a received response into either the decoded body or an exception.
     *
     * @throws TransportException for error statuses
     * @throws SerializationException if the body does not match {@code responseType}
     */
    protected <T> T decode(HttpRequest request, HttpResponse<String> response, JavaType responseType) {
        int statusCode = response.statusCode();
        logger.debug("{} {} -> {}", request.method(), request.uri(), statusCode);

        if (statusCode >= 400) {
            ApiError apiError = readApiError(response.body());
            logger.warn("{} {} failed with status {}{}", request.method(), request.uri(), statusCode,
                    apiError != null ? ": " + apiError.message() : "");
            throw new TransportException(
                    statusCode,
                    apiError,
                    "HTTP error: " + statusCode + (apiError != null ? " " + apiError.message() : "")
            );
        }

        try {
            return objectMapper.readValue(response.body(), responseType);
        } catch (JsonProcessingException e) {
            throw new SerializationException(
                    "Failed to decode response of " + request.method() + " " + request.uri()
                            + " as " + responseType, e);
        }
    }

    private ApiError readApiError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(body).get("error");
            return error != null && error.isObject() ? objectMapper.treeToValue(error, ApiError.class) : null;
        } catch (JsonProcessingException e) {
            logger.debug("Error response body is not JSON: {}", body);
            return null;
        }
    }
}
