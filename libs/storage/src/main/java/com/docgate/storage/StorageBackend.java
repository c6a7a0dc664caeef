package com.docgate.storage;

import com.docgate.model.error.BackendUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The single boundary between the gateway core and document storage.
 * <p>
 * Paths follow the REST layout of a CouchDB-compatible server ({@code /{db}},
 * {@code /{db}/{docId}}, {@code /{db}/_bulk_docs}, {@code /{db}/_changes?since=N},
 * {@code /{db}/_find}, {@code /{db}/_local/{id}}, {@code /{db}/_all_docs}); {@link BackendPath}
 * builds them. Failures surface as the typed exceptions of {@code com.docgate.model.error}:
 * {@code DocumentNotFoundException}, {@code ConflictException}, {@code InvalidRequestException}
 * and {@code BackendUnavailableException}.
 */
public interface StorageBackend extends AutoCloseable {

    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Starts a request. Cancelling the returned future abandons the in-flight call.
     *
     * @param path   absolute path including any query string
     * @param method HTTP verb
     * @param body   request body for {@code PUT}/{@code POST}, otherwise null
     */
    CompletableFuture<JsonNode> submit(String path, RequestMethod method, JsonNode body);

    /** Short name used in logs and health reports, e.g. {@code memory}. */
    String name();

    default Duration defaultTimeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Performs a request and waits for it, bounded by {@link #defaultTimeout()}.
     */
    default JsonNode get(String path, RequestMethod method, JsonNode body) {
        return get(path, method, body, defaultTimeout());
    }

    /**
     * Performs a request and waits at most {@code timeout}. On timeout or interruption the call
     * is cancelled and {@link BackendUnavailableException} is thrown.
     */
    default JsonNode get(String path, RequestMethod method, JsonNode body, Duration timeout) {
        CompletableFuture<JsonNode> future = submit(path, method, body);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BackendUnavailableException(
                    "%s %s timed out after %d ms".formatted(method, path, timeout.toMillis()), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted during %s %s".formatted(method, path), e);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause(), method, path);
        }
    }

    @Override
    void close();

    private static RuntimeException rethrow(Throwable cause, RequestMethod method, String path) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new BackendUnavailableException("%s %s failed: %s".formatted(method, path, cause), cause);
    }
}
