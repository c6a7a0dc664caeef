package com.docgate.model;

import com.docgate.model.error.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON conversion between stored documents and {@link VirtualDocument} values.
 * <p>
 * The stored {@code type} field selects the variant. Unknown fields written by other clients
 * of the same database are ignored on read.
 */
public final class DocumentCodec {

    private static final ObjectMapper MAPPER = createMapper();

    private DocumentCodec() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Serializes a document to the JSON body stored in the backend.
     */
    public static ObjectNode toJson(VirtualDocument document) {
        return MAPPER.valueToTree(document);
    }

    /**
     * Reads a stored document, choosing the variant from its {@code type} field.
     *
     * @throws DocumentCodecException if the type is unknown or the body is not a valid document
     */
    public static VirtualDocument fromJson(JsonNode json) {
        String type = json.path("type").asText(null);
        DocumentKind kind = DocumentKind.fromType(type)
                .orElseThrow(() -> new DocumentCodecException(
                        "Unknown document type '%s' for %s".formatted(type, json.path("_id").asText()), null));
        return switch (kind) {
            case USER -> read(json, UserDocument.class);
            case TENANT -> read(json, TenantDocument.class);
        };
    }

    /**
     * Reads a stored document that must be of the given variant.
     *
     * @throws DocumentCodecException if the body is of another type or invalid
     */
    public static <T extends VirtualDocument> T fromJson(JsonNode json, Class<T> type) {
        VirtualDocument document = fromJson(json);
        if (!type.isInstance(document)) {
            throw new DocumentCodecException("Document %s is a %s, expected %s"
                    .formatted(document.id(), document.kind().value(), type.getSimpleName()), null);
        }
        return type.cast(document);
    }

    /**
     * Parses a raw JSON string, as received from an HTTP backend.
     *
     * @throws InvalidRequestException if the text is not JSON
     */
    public static JsonNode parse(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Malformed JSON: " + e.getOriginalMessage());
        }
    }

    /** Returns the shared ObjectMapper (for building request bodies). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static <T> T read(JsonNode json, Class<T> type) {
        try {
            return MAPPER.treeToValue(json, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DocumentCodecException("Failed to read " + type.getSimpleName()
                    + " " + json.path("_id").asText(), e);
        }
    }

    /**
     * Thrown when a stored document cannot be converted to or from its typed form.
     */
    public static class DocumentCodecException extends RuntimeException {
        public DocumentCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
