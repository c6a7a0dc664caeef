package com.docgate.storage.live;

import com.docgate.model.DocumentCodec;
import com.docgate.model.error.BackendUnavailableException;
import com.docgate.model.error.ConflictException;
import com.docgate.model.error.DocumentNotFoundException;
import com.docgate.model.error.InvalidRequestException;
import com.docgate.storage.RequestMethod;
import com.docgate.storage.StorageBackend;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards requests to a CouchDB-compatible server over HTTP.
 * <p>
 * Calls run on OkHttp's dispatcher; cancelling the returned future cancels the HTTP call.
 * Status codes map to the gateway's error kinds: 404 is not-found, 409 and 412 are conflicts,
 * 400 is an invalid request, and authentication failures, 5xx responses and transport errors
 * are reported as an unavailable backend. Conflicts are never retried here.
 */
public final class LiveBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(LiveBackend.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final String authorization;
    private final OkHttpClient client;
    private final Duration defaultTimeout;

    /**
     * @param baseUrl  server root, e.g. {@code http://localhost:5984}
     * @param username basic-auth user, or null for anonymous access
     * @param password basic-auth password
     * @param timeout  per-call timeout and default wait for {@link #get(String, RequestMethod, JsonNode)}
     */
    public LiveBackend(String baseUrl, String username, String password, Duration timeout) {
        this(baseUrl, username, password, timeout, new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build());
    }

    LiveBackend(String baseUrl, String username, String password, Duration timeout, OkHttpClient client) {
        if (baseUrl == null || HttpUrl.parse(baseUrl) == null) {
            throw new IllegalArgumentException("baseUrl must be an http(s) URL: " + baseUrl);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authorization = username == null || username.isBlank()
                ? null
                : Credentials.basic(username, password == null ? "" : password);
        this.client = client;
        this.defaultTimeout = timeout;
    }

    @Override
    public CompletableFuture<JsonNode> submit(String path, RequestMethod method, JsonNode body) {
        Request request = buildRequest(path, method, body);
        Call call = client.newCall(request);
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                log.error("{} {} failed: {}", method, path, e.toString());
                future.completeExceptionally(
                        new BackendUnavailableException("%s %s failed: %s".formatted(method, path, e), e));
            }

            @Override
            public void onResponse(Call completed, Response response) {
                try (response) {
                    future.complete(interpret(method, path, response));
                } catch (IOException | RuntimeException e) {
                    future.completeExceptionally(e instanceof RuntimeException runtime
                            ? runtime
                            : new BackendUnavailableException("Failed to read response of %s %s".formatted(method, path), e));
                }
            }
        });
        return future;
    }

    @Override
    public String name() {
        return "live";
    }

    @Override
    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
        log.debug("Live backend for {} closed", baseUrl);
    }

    private Request buildRequest(String path, RequestMethod method, JsonNode body) {
        if (path == null || !path.startsWith("/")) {
            throw new InvalidRequestException("Path must be absolute: " + path);
        }
        HttpUrl url = HttpUrl.parse(baseUrl + path);
        if (url == null) {
            throw new InvalidRequestException("Invalid path: " + path);
        }
        RequestBody requestBody = method.hasBody()
                ? RequestBody.create(body == null ? "" : body.toString(), JSON)
                : null;
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .method(method.name(), requestBody);
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder.build();
    }

    private static JsonNode interpret(RequestMethod method, String path, Response response) throws IOException {
        ResponseBody responseBody = response.body();
        String text = responseBody == null ? "" : responseBody.string();
        int status = response.code();
        if (response.isSuccessful()) {
            log.debug("{} {} -> {}", method, path, status);
            return text.isBlank() ? NullNode.getInstance() : DocumentCodec.parse(text);
        }
        String reason = reason(text);
        switch (status) {
            case 404 -> throw new DocumentNotFoundException(path);
            case 409, 412 -> throw new ConflictException(path, reason);
            case 400 -> throw new InvalidRequestException("%s %s rejected: %s".formatted(method, path, reason));
            default -> {
                log.error("{} {} -> {} {}", method, path, status, reason);
                throw new BackendUnavailableException("%s %s returned %d: %s".formatted(method, path, status, reason));
            }
        }
    }

    private static String reason(String text) {
        if (text.isBlank()) {
            return "no reason given";
        }
        try {
            JsonNode json = DocumentCodec.parse(text);
            return json.path("reason").asText(json.path("error").asText(text));
        } catch (InvalidRequestException e) {
            return text;
        }
    }
}
