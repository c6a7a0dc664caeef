package com.docgate.storage;

import com.docgate.model.error.InvalidRequestException;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed backend path, plus builders for the paths the gateway issues.
 *
 * @param segments decoded path segments; empty for the server root
 * @param query    decoded query parameters, in the order given
 */
public record BackendPath(List<String> segments, Map<String, String> query) {

    public static final String BULK_DOCS = "_bulk_docs";
    public static final String CHANGES = "_changes";
    public static final String FIND = "_find";
    public static final String LOCAL = "_local";
    public static final String ALL_DOCS = "_all_docs";

    public BackendPath {
        segments = List.copyOf(segments);
        query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
    }

    /**
     * Parses a raw path such as {@code /db/_changes?since=3&limit=10}.
     *
     * @throws InvalidRequestException if the path is null or not absolute
     */
    public static BackendPath parse(String raw) {
        if (raw == null || !raw.startsWith("/")) {
            throw new InvalidRequestException("Path must be absolute: " + raw);
        }
        int q = raw.indexOf('?');
        String pathPart = q >= 0 ? raw.substring(0, q) : raw;
        String queryPart = q >= 0 ? raw.substring(q + 1) : "";

        List<String> segments = new ArrayList<>();
        for (String segment : pathPart.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(decode(segment));
            }
        }
        Map<String, String> query = new LinkedHashMap<>();
        for (String pair : queryPart.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq >= 0) {
                query.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
            } else {
                query.put(decode(pair), "");
            }
        }
        return new BackendPath(segments, query);
    }

    public Optional<String> database() {
        return segments.isEmpty() ? Optional.empty() : Optional.of(segments.get(0));
    }

    public Optional<String> param(String name) {
        return Optional.ofNullable(query.get(name));
    }

    public boolean flag(String name) {
        return "true".equalsIgnoreCase(query.get(name));
    }

    /**
     * Reads a non-negative integer query parameter.
     *
     * @throws InvalidRequestException if the value is present but not a non-negative integer
     */
    public Optional<Long> longParam(String name) {
        String value = query.get(name);
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0) {
                throw new InvalidRequestException("%s must not be negative: %s".formatted(name, value));
            }
            return Optional.of(parsed);
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("%s must be an integer: %s".formatted(name, value));
        }
    }

    public static String root() {
        return "/";
    }

    public static String database(String db) {
        return "/" + encode(db);
    }

    public static String document(String db, String docId) {
        return database(db) + "/" + encode(docId);
    }

    public static String bulkDocs(String db) {
        return database(db) + "/" + BULK_DOCS;
    }

    public static String find(String db) {
        return database(db) + "/" + FIND;
    }

    public static String allDocs(String db, boolean includeDocs) {
        return database(db) + "/" + ALL_DOCS + (includeDocs ? "?include_docs=true" : "");
    }

    public static String local(String db, String localId) {
        return database(db) + "/" + LOCAL + "/" + encode(localId);
    }

    /**
     * Change feed path.
     *
     * @param since cursor exactly as the backend reported it in {@code last_seq}
     * @param limit maximum number of results, or null for no limit
     */
    public static String changes(String db, String since, Integer limit, boolean includeDocs) {
        StringBuilder path = new StringBuilder(database(db)).append('/').append(CHANGES)
                .append("?since=").append(encode(since));
        if (limit != null) {
            path.append("&limit=").append(limit);
        }
        if (includeDocs) {
            path.append("&include_docs=true");
        }
        return path.toString();
    }

    public static String changes(String db, long since, Integer limit, boolean includeDocs) {
        return changes(db, Long.toString(since), limit, includeDocs);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
